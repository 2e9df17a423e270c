package com.orderpipeline.worker.dispatch;

import com.orderpipeline.domain.orders.AggregateSnapshot;
import com.orderpipeline.domain.orders.Order;
import com.orderpipeline.domain.orders.OrderAggregator;
import com.orderpipeline.infra.kafka.contract.DeadLetterMetadata;
import com.orderpipeline.infra.kafka.contract.MessageEnvelope;
import com.orderpipeline.infra.kafka.contract.RetryHeaders;
import com.orderpipeline.infra.kafka.errors.EscalationDecision;
import com.orderpipeline.infra.kafka.errors.EscalationPolicy;
import com.orderpipeline.infra.kafka.errors.RetryTracker;
import com.orderpipeline.infra.kafka.observability.PipelineTelemetry;
import com.orderpipeline.infra.kafka.producer.EnvelopePublisher;
import com.orderpipeline.infra.kafka.producer.KafkaPublishException;
import com.orderpipeline.infra.kafka.serde.DeadLetterMetadataCodec;
import com.orderpipeline.infra.kafka.topics.TopicNames;
import com.orderpipeline.worker.codec.OrderCodec;
import com.orderpipeline.worker.codec.OrderDecodeException;
import com.orderpipeline.worker.processing.OrderProcessor;
import com.orderpipeline.worker.processing.ProcessingResult;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one inbound order message through decode, processing and escalation.
 *
 * <p>A processing failure never escapes this class: the message is re-published either to the
 * retry topic, with its retry counter incremented, or to the dead-letter topic once the policy's
 * retry budget is spent. Publish failures and, in {@link DecodeFailureMode#PROPAGATE} mode,
 * decode failures are rethrown so the listener container can apply its error handling.
 *
 * <p>The retry counter is always read from the message headers, so messages arriving from the
 * primary and the retry topic follow the same path.
 *
 * <p>The acknowledge callback runs once the message has been fully handed off: after aggregation,
 * after the dead-letter publish, or after the retry publish and before the backoff sleep. It does
 * not run when an exception escapes.
 */
public class OrderDispatcher {
  private static final Logger log = LoggerFactory.getLogger(OrderDispatcher.class);

  private final OrderCodec codec;
  private final OrderProcessor processor;
  private final OrderAggregator aggregator;
  private final EscalationPolicy escalationPolicy;
  private final EnvelopePublisher publisher;
  private final DeadLetterMetadataCodec deadLetterMetadataCodec;
  private final TopicNames topicNames;
  private final DecodeFailureMode decodeFailureMode;
  private final BackoffSleeper backoffSleeper;
  private final Clock clock;
  private final PipelineTelemetry telemetry;

  public OrderDispatcher(
      OrderCodec codec,
      OrderProcessor processor,
      OrderAggregator aggregator,
      EscalationPolicy escalationPolicy,
      EnvelopePublisher publisher,
      DeadLetterMetadataCodec deadLetterMetadataCodec,
      TopicNames topicNames,
      DecodeFailureMode decodeFailureMode,
      BackoffSleeper backoffSleeper,
      Clock clock,
      PipelineTelemetry telemetry) {
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
    this.processor = Objects.requireNonNull(processor, "processor must not be null");
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
    this.escalationPolicy =
        Objects.requireNonNull(escalationPolicy, "escalationPolicy must not be null");
    this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
    this.deadLetterMetadataCodec =
        Objects.requireNonNull(deadLetterMetadataCodec, "deadLetterMetadataCodec must not be null");
    this.topicNames = Objects.requireNonNull(topicNames, "topicNames must not be null");
    this.decodeFailureMode =
        Objects.requireNonNull(decodeFailureMode, "decodeFailureMode must not be null");
    this.backoffSleeper = Objects.requireNonNull(backoffSleeper, "backoffSleeper must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
  }

  public DispatchOutcome dispatch(String sourceTopic, MessageEnvelope envelope) {
    return dispatch(sourceTopic, envelope, () -> {});
  }

  public DispatchOutcome dispatch(
      String sourceTopic, MessageEnvelope envelope, Runnable acknowledge) {
    Objects.requireNonNull(envelope, "envelope must not be null");
    Objects.requireNonNull(acknowledge, "acknowledge must not be null");
    long started = System.nanoTime();

    Order order;
    try {
      order = codec.decode(envelope.payload());
    } catch (OrderDecodeException ex) {
      return handleDecodeFailure(sourceTopic, envelope, ex, acknowledge);
    }

    ProcessingResult result;
    try {
      result = processor.process(order);
    } catch (RuntimeException ex) {
      result = ProcessingResult.failure(errorMessage(ex));
    }

    if (result.succeeded()) {
      AggregateSnapshot snapshot = aggregator.update(order.amount());
      telemetry.onProcessed(sourceTopic, envelope.key(), System.nanoTime() - started);
      log.info(
          "Order processed key={} topic={} outcome={} total_orders={} running_total={} running_average={}",
          envelope.key(),
          sourceTopic,
          DispatchOutcome.SUCCEEDED,
          snapshot.count(),
          snapshot.total(),
          snapshot.average());
      acknowledge.run();
      return DispatchOutcome.SUCCEEDED;
    }

    telemetry.onProcessingFailure(sourceTopic, envelope.key());
    return escalate(sourceTopic, envelope, result.failureReason(), acknowledge);
  }

  private DispatchOutcome handleDecodeFailure(
      String sourceTopic,
      MessageEnvelope envelope,
      OrderDecodeException ex,
      Runnable acknowledge) {
    telemetry.onDecodeFailure(sourceTopic, envelope.key(), ex);
    if (decodeFailureMode == DecodeFailureMode.PROPAGATE) {
      log.warn(
          "Order decode failed key={} topic={} outcome=propagated error={}",
          envelope.key(),
          sourceTopic,
          errorMessage(ex));
      throw ex;
    }
    int currentRetryCount = RetryTracker.extractRetryCount(envelope.headers());
    return deadLetter(sourceTopic, envelope, errorMessage(ex), currentRetryCount, acknowledge);
  }

  private DispatchOutcome escalate(
      String sourceTopic, MessageEnvelope envelope, String error, Runnable acknowledge) {
    int currentRetryCount = RetryTracker.extractRetryCount(envelope.headers());
    EscalationDecision decision = escalationPolicy.decide(currentRetryCount);
    if (decision == EscalationDecision.RETRY) {
      return retry(sourceTopic, envelope, error, currentRetryCount, acknowledge);
    }
    return deadLetter(sourceTopic, envelope, error, currentRetryCount, acknowledge);
  }

  private DispatchOutcome retry(
      String sourceTopic,
      MessageEnvelope envelope,
      String error,
      int currentRetryCount,
      Runnable acknowledge) {
    int nextRetryCount = RetryTracker.incrementRetryCount(envelope.headers());
    Map<String, String> retryHeaders = new LinkedHashMap<>();
    retryHeaders.put(RetryHeaders.RETRY_COUNT, Integer.toString(nextRetryCount));
    retryHeaders.put(RetryHeaders.ERROR, error);
    retryHeaders.put(RetryHeaders.ORIGINAL_TOPIC, topicNames.primary());
    retryHeaders.put(RetryHeaders.LAST_ATTEMPT_AT, Long.toString(clock.millis()));

    join(publisher.publish(topicNames.retry(), envelope.withHeaders(retryHeaders)));
    telemetry.onRetry(sourceTopic, envelope.key(), nextRetryCount);
    log.warn(
        "Order processing failed key={} topic={} outcome={} error={} retry_count={} max_retries={}",
        envelope.key(),
        sourceTopic,
        DispatchOutcome.RETRIED,
        error,
        nextRetryCount,
        escalationPolicy.maxRetries());
    acknowledge.run();

    sleepBackoff(envelope.key(), escalationPolicy.backoffDelay(currentRetryCount));
    return DispatchOutcome.RETRIED;
  }

  private DispatchOutcome deadLetter(
      String sourceTopic,
      MessageEnvelope envelope,
      String error,
      int currentRetryCount,
      Runnable acknowledge) {
    DeadLetterMetadata metadata =
        new DeadLetterMetadata(currentRetryCount, topicNames.primary(), error, clock.millis());
    Map<String, String> dlqHeaders = new LinkedHashMap<>();
    dlqHeaders.put(RetryHeaders.DLQ_METADATA, deadLetterMetadataCodec.encode(metadata));
    dlqHeaders.put(RetryHeaders.FINAL_ERROR, error);

    join(publisher.publish(topicNames.deadLetter(), envelope.withHeaders(dlqHeaders)));
    telemetry.onDeadLetter(sourceTopic, envelope.key(), currentRetryCount);
    log.error(
        "Order dead-lettered key={} topic={} outcome={} error={} retry_count={} dlq_topic={}",
        envelope.key(),
        sourceTopic,
        DispatchOutcome.DEAD_LETTERED,
        error,
        currentRetryCount,
        topicNames.deadLetter());
    acknowledge.run();
    return DispatchOutcome.DEAD_LETTERED;
  }

  private void sleepBackoff(String key, Duration delay) {
    try {
      backoffSleeper.sleep(delay);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Retry backoff interrupted key={} delay_ms={}", key, delay.toMillis());
    }
  }

  private static <T> T join(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (CompletionException ex) {
      if (ex.getCause() instanceof KafkaPublishException publishException) {
        throw publishException;
      }
      throw ex;
    }
  }

  private static String errorMessage(Throwable ex) {
    String message = ex.getMessage();
    if (message == null || message.isBlank()) {
      return ex.getClass().getSimpleName();
    }
    return message;
  }
}
