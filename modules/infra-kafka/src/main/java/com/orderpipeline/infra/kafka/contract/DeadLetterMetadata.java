package com.orderpipeline.infra.kafka.contract;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Objects;

/**
 * Final retry state recorded in the {@link RetryHeaders#DLQ_METADATA} header of a dead-lettered
 * message. {@code timestamp} is epoch milliseconds.
 */
@JsonPropertyOrder({"retryCount", "originalTopic", "error", "timestamp"})
public record DeadLetterMetadata(
    int retryCount, String originalTopic, String error, long timestamp) {
  public DeadLetterMetadata {
    if (retryCount < 0) {
      throw new IllegalArgumentException("retryCount must be >= 0");
    }
    Objects.requireNonNull(originalTopic, "originalTopic must not be null");
    Objects.requireNonNull(error, "error must not be null");
  }
}
