package com.orderpipeline.infra.kafka.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;

public class MicrometerPipelineTelemetry implements PipelineTelemetry {
  private final MeterRegistry meterRegistry;

  public MicrometerPipelineTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onPublishSuccess(String topic, String key, long durationNanos) {
    Counter.builder("pipeline.kafka.publish.total")
        .description("Total Kafka publish attempts by outcome")
        .tag("topic", safeValue(topic))
        .tag("outcome", "success")
        .register(meterRegistry)
        .increment();

    Timer.builder("pipeline.kafka.publish.duration")
        .description("Kafka publish latency")
        .tag("topic", safeValue(topic))
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onPublishFailure(String topic, String key, Throwable error) {
    Counter.builder("pipeline.kafka.publish.total")
        .description("Total Kafka publish attempts by outcome")
        .tag("topic", safeValue(topic))
        .tag("outcome", "failure")
        .tag("error", safeError(error))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onProcessed(String topic, String key, long durationNanos) {
    consumeCounter(topic, "success").increment();

    Timer.builder("pipeline.orders.consume.duration")
        .description("Order processing latency")
        .tag("topic", safeValue(topic))
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onProcessingFailure(String topic, String key) {
    consumeCounter(topic, "failure").increment();
  }

  @Override
  public void onDecodeFailure(String topic, String key, Throwable error) {
    Counter.builder("pipeline.orders.decode.failure.total")
        .description("Total order messages whose payload could not be decoded")
        .tag("topic", safeValue(topic))
        .tag("error", safeError(error))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onRetry(String topic, String key, int retryCount) {
    Counter.builder("pipeline.orders.retry.total")
        .description("Total messages re-published to the retry topic")
        .tag("topic", safeValue(topic))
        .register(meterRegistry)
        .increment();

    DistributionSummary.builder("pipeline.orders.retry.count")
        .description("Retry count carried by re-published messages")
        .tag("topic", safeValue(topic))
        .register(meterRegistry)
        .record(Math.max(0, retryCount));
  }

  @Override
  public void onDeadLetter(String topic, String key, int retryCount) {
    Counter.builder("pipeline.orders.deadletter.total")
        .description("Total messages published to the dead-letter topic")
        .tag("topic", safeValue(topic))
        .register(meterRegistry)
        .increment();
  }

  private Counter consumeCounter(String topic, String outcome) {
    return Counter.builder("pipeline.orders.consume.total")
        .description("Total consumed order messages by outcome")
        .tag("topic", safeValue(topic))
        .tag("outcome", outcome)
        .register(meterRegistry);
  }

  private static String safeValue(String value) {
    if (value == null || value.isBlank()) {
      return "unknown";
    }
    return value;
  }

  private static String safeError(Throwable error) {
    if (error == null) {
      return "none";
    }
    return error.getClass().getSimpleName();
  }
}
