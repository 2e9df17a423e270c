package com.orderpipeline.infra.kafka.errors;

import java.time.Duration;
import java.util.Objects;

/**
 * Backoff that grows with the number of earlier retries: {@code initial * multiplier^retryCount},
 * capped at {@code maxBackoff}.
 */
public class ExponentialBackoffEscalationPolicy implements EscalationPolicy {
  private final int maxRetries;
  private final Duration initialBackoff;
  private final Duration maxBackoff;
  private final double multiplier;

  public ExponentialBackoffEscalationPolicy(
      int maxRetries, Duration initialBackoff, Duration maxBackoff, double multiplier) {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    this.maxRetries = maxRetries;
    this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
    this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
    this.multiplier = Math.max(1.0d, multiplier);
  }

  @Override
  public int maxRetries() {
    return maxRetries;
  }

  @Override
  public Duration backoffDelay(int currentRetryCount) {
    long initialMillis = Math.max(0L, initialBackoff.toMillis());
    long maxMillis = Math.max(initialMillis, maxBackoff.toMillis());
    if (initialMillis == 0L) {
      return Duration.ZERO;
    }

    int exponent = Math.max(0, currentRetryCount);
    double scaled = initialMillis * Math.pow(multiplier, exponent);
    long bounded = (long) Math.min(maxMillis, scaled);
    return Duration.ofMillis(Math.max(0L, bounded));
  }
}
