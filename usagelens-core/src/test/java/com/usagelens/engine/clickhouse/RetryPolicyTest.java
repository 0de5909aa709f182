package com.usagelens.engine.clickhouse;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {

  @Test
  void backoffGrowsLinearlyWithBoundedJitter() {
    RetryPolicy policy = RetryPolicy.reads();

    assertThat(policy.computeDelayMillis(1)).isEqualTo(250);
    assertThat(policy.computeDelayMillis(3)).isEqualTo(750);
    for (int i = 0; i < 50; i++) {
      assertThat(policy.delayWithJitterMillis(2)).isBetween(500L, 600L);
    }
  }

  @Test
  void retriesStopAtMaximum() {
    RetryPolicy policy = new RetryPolicy(2, 10, 0);

    assertThat(policy.canRetry(0)).isTrue();
    assertThat(policy.canRetry(1)).isTrue();
    assertThat(policy.canRetry(2)).isFalse();
    assertThat(RetryPolicy.none().canRetry(0)).isFalse();
  }
}
