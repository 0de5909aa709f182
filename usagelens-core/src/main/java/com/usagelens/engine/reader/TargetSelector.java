package com.usagelens.engine.reader;

import java.util.List;
import java.util.Objects;

/**
 * Which targets a read covers. Authorization of the selector is the caller's job.
 */
public record TargetSelector(String organizationId, String projectId, List<String> targetIds) {

  public TargetSelector {
    Objects.requireNonNull(targetIds, "targetIds");
    targetIds = List.copyOf(targetIds);
    if (targetIds.isEmpty()) {
      throw new IllegalArgumentException("at least one target is required");
    }
  }

  public static TargetSelector of(String organizationId, String projectId, String targetId) {
    return new TargetSelector(organizationId, projectId, List.of(targetId));
  }

  public static TargetSelector ofTargets(List<String> targetIds) {
    return new TargetSelector(null, null, targetIds);
  }

  public boolean isSingle() {
    return targetIds.size() == 1;
  }

  public String key() {
    return String.join(",", targetIds);
  }
}
