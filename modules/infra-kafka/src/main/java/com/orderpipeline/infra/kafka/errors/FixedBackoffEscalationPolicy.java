package com.orderpipeline.infra.kafka.errors;

import java.time.Duration;
import java.util.Objects;

public class FixedBackoffEscalationPolicy implements EscalationPolicy {
  private final int maxRetries;
  private final Duration backoff;

  public FixedBackoffEscalationPolicy(int maxRetries, Duration backoff) {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    this.maxRetries = maxRetries;
    this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
    if (backoff.isNegative()) {
      throw new IllegalArgumentException("backoff must be >= 0");
    }
  }

  @Override
  public int maxRetries() {
    return maxRetries;
  }

  @Override
  public Duration backoffDelay(int currentRetryCount) {
    return backoff;
  }
}
