package com.orderpipeline.infra.kafka.observability;

public interface PipelineTelemetry {
  void onPublishSuccess(String topic, String key, long durationNanos);

  void onPublishFailure(String topic, String key, Throwable error);

  void onProcessed(String topic, String key, long durationNanos);

  void onProcessingFailure(String topic, String key);

  void onDecodeFailure(String topic, String key, Throwable error);

  void onRetry(String topic, String key, int retryCount);

  void onDeadLetter(String topic, String key, int retryCount);
}
