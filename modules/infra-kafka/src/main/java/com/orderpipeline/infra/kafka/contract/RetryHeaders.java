package com.orderpipeline.infra.kafka.contract;

/** Header names carrying retry and dead-letter metadata on re-published envelopes. */
public final class RetryHeaders {
  public static final String RETRY_COUNT = "retryCount";
  public static final String ERROR = "error";
  public static final String ORIGINAL_TOPIC = "originalTopic";
  public static final String LAST_ATTEMPT_AT = "lastAttemptAt";

  public static final String DLQ_METADATA = "dlqMetadata";
  public static final String FINAL_ERROR = "finalError";

  private RetryHeaders() {}
}
