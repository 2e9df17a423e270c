package com.orderpipeline.infra.kafka.observability;

public class NoOpPipelineTelemetry implements PipelineTelemetry {
  @Override
  public void onPublishSuccess(String topic, String key, long durationNanos) {}

  @Override
  public void onPublishFailure(String topic, String key, Throwable error) {}

  @Override
  public void onProcessed(String topic, String key, long durationNanos) {}

  @Override
  public void onProcessingFailure(String topic, String key) {}

  @Override
  public void onDecodeFailure(String topic, String key, Throwable error) {}

  @Override
  public void onRetry(String topic, String key, int retryCount) {}

  @Override
  public void onDeadLetter(String topic, String key, int retryCount) {}
}
