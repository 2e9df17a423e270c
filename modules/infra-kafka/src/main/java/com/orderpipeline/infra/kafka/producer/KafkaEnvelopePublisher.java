package com.orderpipeline.infra.kafka.producer;

import com.orderpipeline.infra.kafka.observability.PipelineTelemetry;
import com.orderpipeline.infra.kafka.topics.TopicNameValidator;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

public class KafkaEnvelopePublisher implements EnvelopePublisher {
  private static final Logger log = LoggerFactory.getLogger(KafkaEnvelopePublisher.class);

  private final KafkaTemplate<String, byte[]> kafkaTemplate;
  private final PipelineTelemetry telemetry;
  private final Duration sendTimeout;

  public KafkaEnvelopePublisher(
      KafkaTemplate<String, byte[]> kafkaTemplate, PipelineTelemetry telemetry) {
    this(kafkaTemplate, telemetry, Duration.ZERO);
  }

  public KafkaEnvelopePublisher(
      KafkaTemplate<String, byte[]> kafkaTemplate,
      PipelineTelemetry telemetry,
      Duration sendTimeout) {
    this.kafkaTemplate = Objects.requireNonNull(kafkaTemplate, "kafkaTemplate must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    this.sendTimeout = sendTimeout == null ? Duration.ZERO : sendTimeout;
  }

  @Override
  public CompletableFuture<SendResult<String, byte[]>> publish(
      String topic, String key, byte[] payload, Map<String, String> headers) {
    TopicNameValidator.assertValid(topic);
    Objects.requireNonNull(payload, "payload must not be null");
    Objects.requireNonNull(headers, "headers must not be null");

    long started = System.nanoTime();
    ProducerRecord<String, byte[]> record = new ProducerRecord<>(topic, key, payload);
    headers.forEach(
        (name, value) -> {
          if (value != null) {
            record.headers().add(name, value.getBytes(StandardCharsets.UTF_8));
          }
        });

    CompletableFuture<SendResult<String, byte[]>> sendFuture;
    try {
      sendFuture = kafkaTemplate.send(record);
    } catch (RuntimeException ex) {
      sendFuture = CompletableFuture.failedFuture(ex);
    }
    CompletableFuture<SendResult<String, byte[]>> effectiveFuture = applyTimeout(sendFuture);

    CompletableFuture<SendResult<String, byte[]>> result = new CompletableFuture<>();
    effectiveFuture.whenComplete(
        (sendResult, throwable) -> {
          if (throwable == null) {
            telemetry.onPublishSuccess(topic, key, System.nanoTime() - started);
            result.complete(sendResult);
            return;
          }

          KafkaPublishException publishException = wrapPublishException(topic, key, throwable);
          log.error(
              "Kafka publish failed topic={} key={} error={}",
              topic,
              key,
              publishException.getCause() == null
                  ? publishException.getMessage()
                  : publishException.getCause().getClass().getSimpleName());
          telemetry.onPublishFailure(topic, key, publishException);
          result.completeExceptionally(publishException);
        });
    return result;
  }

  private CompletableFuture<SendResult<String, byte[]>> applyTimeout(
      CompletableFuture<SendResult<String, byte[]>> sendFuture) {
    if (sendTimeout.isZero() || sendTimeout.isNegative()) {
      return sendFuture;
    }
    return sendFuture.orTimeout(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  private KafkaPublishException wrapPublishException(
      String topic, String key, Throwable throwable) {
    Throwable cause = unwrap(throwable);
    if (cause instanceof KafkaPublishException existing) {
      return existing;
    }

    String message;
    if (cause instanceof TimeoutException) {
      message = "Timed out publishing message to Kafka topic=" + topic + " key=" + key;
    } else {
      message = "Failed to publish message to Kafka topic=" + topic + " key=" + key;
    }
    return new KafkaPublishException(topic, key, message, cause);
  }

  private Throwable unwrap(Throwable throwable) {
    if (throwable instanceof CompletionException completionException
        && completionException.getCause() != null) {
      return completionException.getCause();
    }
    return throwable;
  }
}
