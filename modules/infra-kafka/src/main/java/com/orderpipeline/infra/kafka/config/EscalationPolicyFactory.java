package com.orderpipeline.infra.kafka.config;

import com.orderpipeline.infra.kafka.errors.EscalationPolicy;
import com.orderpipeline.infra.kafka.errors.ExponentialBackoffEscalationPolicy;
import com.orderpipeline.infra.kafka.errors.FixedBackoffEscalationPolicy;
import java.time.Duration;

public final class EscalationPolicyFactory {
  private EscalationPolicyFactory() {}

  public static EscalationPolicy create(InfraKafkaProperties.Retry retry) {
    if (retry == null) {
      return new FixedBackoffEscalationPolicy(3, Duration.ofMillis(2000L));
    }
    if (retry.getMaxRetries() < 0) {
      throw new IllegalArgumentException(
          "infra.kafka.retry.max-retries must be >= 0: " + retry.getMaxRetries());
    }
    if (retry.getRetryDelayMs() < 0L) {
      throw new IllegalArgumentException(
          "infra.kafka.retry.retry-delay-ms must be >= 0: " + retry.getRetryDelayMs());
    }

    String mode = retry.getMode() == null ? "fixed" : retry.getMode().trim().toLowerCase();
    if ("fixed".equals(mode)) {
      return new FixedBackoffEscalationPolicy(
          retry.getMaxRetries(), Duration.ofMillis(retry.getRetryDelayMs()));
    }
    if ("exponential".equals(mode)) {
      return new ExponentialBackoffEscalationPolicy(
          retry.getMaxRetries(),
          Duration.ofMillis(retry.getRetryDelayMs()),
          Duration.ofMillis(Math.max(0L, retry.getMaxRetryDelayMs())),
          retry.getMultiplier());
    }
    throw new IllegalArgumentException("Unsupported infra.kafka.retry.mode: " + retry.getMode());
  }
}
