package com.orderpipeline.infra.kafka.errors;

public enum EscalationDecision {
  RETRY,
  DEAD_LETTER;

  public static EscalationDecision of(int currentRetryCount, int maxRetries) {
    return currentRetryCount < maxRetries ? RETRY : DEAD_LETTER;
  }
}
