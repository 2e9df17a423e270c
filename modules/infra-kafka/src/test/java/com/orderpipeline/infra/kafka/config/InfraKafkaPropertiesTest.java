package com.orderpipeline.infra.kafka.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.orderpipeline.infra.kafka.topics.TopicNames;
import java.util.List;
import org.junit.jupiter.api.Test;

class InfraKafkaPropertiesTest {
  @Test
  void shouldExposeOrderPipelineDefaults() {
    InfraKafkaProperties properties = new InfraKafkaProperties();

    assertEquals("localhost:9092", properties.bootstrapServersAsCsv());
    assertEquals("order-processing-system", properties.getProducer().getClientId());
    assertEquals("order-consumer-group", properties.getConsumer().getGroupId());
    assertEquals("earliest", properties.getConsumer().getAutoOffsetReset());
    assertEquals(50, properties.getConsumer().getMaxPollRecords());
    assertTrue(properties.getProducer().isIdempotenceEnabled());
    assertEquals(1, properties.getConsumer().getConcurrency());
    assertEquals("fixed", properties.getRetry().getMode());
    assertEquals(3, properties.getRetry().getMaxRetries());
    assertEquals(2000L, properties.getRetry().getRetryDelayMs());
    assertTrue(properties.getTopics().isEnabled());
    assertEquals(TopicNames.defaults(), properties.getTopics().toTopicNames());
  }

  @Test
  void shouldJoinBootstrapServers() {
    InfraKafkaProperties properties = new InfraKafkaProperties();
    properties.setBootstrapServers(List.of("kafka-1:9092", "kafka-2:9092"));

    assertEquals("kafka-1:9092,kafka-2:9092", properties.bootstrapServersAsCsv());
  }
}
