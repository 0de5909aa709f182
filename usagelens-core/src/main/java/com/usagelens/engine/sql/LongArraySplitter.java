package com.usagelens.engine.sql;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

@UtilityClass
public class LongArraySplitter {

  /** Default ceiling, overridden by {@code usage.sql.long-array-char-limit}. */
  public static final int DEFAULT_CHAR_LIMIT = 10_000;

  /** Two quotes, a comma and a space around every serialized element. */
  public static final int PER_ELEMENT_OVERHEAD = 4;

  /**
   * Greedily packs values, in order, into batches whose estimated serialized size stays within
   * {@code charLimit}. A value that alone exceeds the limit gets a batch of its own.
   */
  public static List<List<String>> split(List<String> values, int charLimit) {
    List<List<String>> batches = new ArrayList<>();
    List<String> current = new ArrayList<>();
    long currentSize = 0;

    for (String value : values) {
      long size = estimatedSize(value);
      if (!current.isEmpty() && currentSize + size > charLimit) {
        batches.add(List.copyOf(current));
        current = new ArrayList<>();
        currentSize = 0;
      }
      current.add(value);
      currentSize += size;
    }

    if (!current.isEmpty() || batches.isEmpty()) {
      batches.add(List.copyOf(current));
    }
    return batches;
  }

  public static long estimatedSize(String value) {
    return (long) value.length() + PER_ELEMENT_OVERHEAD;
  }
}
