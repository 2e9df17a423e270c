package com.orderpipeline.worker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderpipeline.domain.orders.OrderAggregator;
import com.orderpipeline.infra.kafka.errors.EscalationPolicy;
import com.orderpipeline.infra.kafka.observability.PipelineTelemetry;
import com.orderpipeline.infra.kafka.producer.EnvelopePublisher;
import com.orderpipeline.infra.kafka.serde.DeadLetterMetadataCodec;
import com.orderpipeline.infra.kafka.topics.TopicNames;
import com.orderpipeline.worker.codec.JsonOrderCodec;
import com.orderpipeline.worker.codec.OrderCodec;
import com.orderpipeline.worker.dispatch.BackoffSleeper;
import com.orderpipeline.worker.dispatch.DecodeFailureMode;
import com.orderpipeline.worker.dispatch.OrderDispatcher;
import com.orderpipeline.worker.processing.FailureSource;
import com.orderpipeline.worker.processing.OrderProcessor;
import com.orderpipeline.worker.processing.RandomFailureSource;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import java.time.Clock;
import java.util.Random;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(OrderPipelineProperties.class)
public class OrderPipelineConfiguration {
  @Bean
  OrderAggregator orderAggregator() {
    return new OrderAggregator();
  }

  @Bean
  @ConditionalOnMissingBean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  FailureSource failureSource(OrderPipelineProperties properties) {
    return new RandomFailureSource(properties.getFailureProbability(), new Random());
  }

  @Bean
  OrderProcessor orderProcessor(FailureSource failureSource) {
    return new OrderProcessor(failureSource);
  }

  @Bean
  @ConditionalOnMissingBean
  OrderCodec orderCodec(@Qualifier("kafkaEventObjectMapper") ObjectMapper kafkaEventObjectMapper) {
    return new JsonOrderCodec(kafkaEventObjectMapper);
  }

  @Bean
  @ConditionalOnMissingBean
  BackoffSleeper backoffSleeper() {
    return BackoffSleeper.threadSleep();
  }

  @Bean
  OrderDispatcher orderDispatcher(
      OrderCodec orderCodec,
      OrderProcessor orderProcessor,
      OrderAggregator orderAggregator,
      EscalationPolicy escalationPolicy,
      EnvelopePublisher envelopePublisher,
      DeadLetterMetadataCodec deadLetterMetadataCodec,
      TopicNames topicNames,
      BackoffSleeper backoffSleeper,
      Clock clock,
      PipelineTelemetry pipelineTelemetry,
      OrderPipelineProperties properties) {
    return new OrderDispatcher(
        orderCodec,
        orderProcessor,
        orderAggregator,
        escalationPolicy,
        envelopePublisher,
        deadLetterMetadataCodec,
        topicNames,
        DecodeFailureMode.from(properties.getDecodeFailureMode()),
        backoffSleeper,
        clock,
        pipelineTelemetry);
  }

  @Bean
  MeterBinder orderAggregateMetrics(OrderAggregator orderAggregator) {
    return registry -> {
      Gauge.builder("pipeline.orders.aggregate.count", orderAggregator, a -> a.snapshot().count())
          .description("Orders processed successfully since startup")
          .register(registry);
      Gauge.builder(
              "pipeline.orders.aggregate.total",
              orderAggregator,
              a -> a.snapshot().total().doubleValue())
          .description("Running total of processed order amounts")
          .register(registry);
      Gauge.builder(
              "pipeline.orders.aggregate.average",
              orderAggregator,
              a -> a.snapshot().average().doubleValue())
          .description("Running average of processed order amounts")
          .register(registry);
    };
  }
}
