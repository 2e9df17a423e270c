package com.orderpipeline.infra.kafka.errors;

import java.time.Duration;

/** Chooses between the retry topic and the dead-letter topic for a failed message. */
public interface EscalationPolicy {
  int maxRetries();

  Duration backoffDelay(int currentRetryCount);

  default EscalationDecision decide(int currentRetryCount) {
    return EscalationDecision.of(currentRetryCount, maxRetries());
  }
}
