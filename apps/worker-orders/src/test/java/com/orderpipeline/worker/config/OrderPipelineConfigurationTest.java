package com.orderpipeline.worker.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.orderpipeline.domain.orders.OrderAggregator;
import com.orderpipeline.infra.kafka.config.InfraKafkaAutoConfiguration;
import com.orderpipeline.worker.codec.JsonOrderCodec;
import com.orderpipeline.worker.codec.OrderCodec;
import com.orderpipeline.worker.dispatch.OrderDispatcher;
import com.orderpipeline.worker.processing.FailureSource;
import com.orderpipeline.worker.processing.RandomFailureSource;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class OrderPipelineConfigurationTest {
  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(InfraKafkaAutoConfiguration.class, OrderPipelineConfiguration.class)
          .withPropertyValues("infra.kafka.topics.enabled=false");

  @Test
  void shouldWireDispatcherWithDefaults() {
    contextRunner.run(
        context -> {
          assertNotNull(context.getBean(OrderDispatcher.class));
          assertEquals(JsonOrderCodec.class, context.getBean(OrderCodec.class).getClass());
          FailureSource failureSource = context.getBean(FailureSource.class);
          assertEquals(RandomFailureSource.class, failureSource.getClass());
          assertEquals(0.1d, ((RandomFailureSource) failureSource).probability());
        });
  }

  @Test
  void shouldBindFailureProbability() {
    contextRunner
        .withPropertyValues("pipeline.orders.failure-probability=0.5")
        .run(
            context ->
                assertEquals(
                    0.5d, ((RandomFailureSource) context.getBean(FailureSource.class)).probability()));
  }

  @Test
  void shouldFailStartupForUnknownDecodeFailureMode() {
    contextRunner
        .withPropertyValues("pipeline.orders.decode-failure-mode=ignore")
        .run(context -> assertTrue(context.getStartupFailure() != null));
  }

  @Test
  void shouldExposeAggregateGauges() {
    contextRunner.run(
        context -> {
          OrderAggregator aggregator = context.getBean(OrderAggregator.class);
          aggregator.update(new BigDecimal("10.00"));
          aggregator.update(new BigDecimal("30.00"));

          SimpleMeterRegistry registry = new SimpleMeterRegistry();
          context.getBeansOfType(MeterBinder.class).values().forEach(b -> b.bindTo(registry));

          assertEquals(2.0d, registry.get("pipeline.orders.aggregate.count").gauge().value());
          assertEquals(40.0d, registry.get("pipeline.orders.aggregate.total").gauge().value());
          assertEquals(20.0d, registry.get("pipeline.orders.aggregate.average").gauge().value());
        });
  }
}
