package com.orderpipeline.infra.kafka.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderpipeline.infra.kafka.consumer.LatestOffsetRebalanceListener;
import com.orderpipeline.infra.kafka.errors.EscalationPolicy;
import com.orderpipeline.infra.kafka.observability.MicrometerPipelineTelemetry;
import com.orderpipeline.infra.kafka.observability.NoOpPipelineTelemetry;
import com.orderpipeline.infra.kafka.observability.PipelineTelemetry;
import com.orderpipeline.infra.kafka.producer.EnvelopePublisher;
import com.orderpipeline.infra.kafka.producer.KafkaEnvelopePublisher;
import com.orderpipeline.infra.kafka.serde.DeadLetterMetadataCodec;
import com.orderpipeline.infra.kafka.serde.EventObjectMapperFactory;
import com.orderpipeline.infra.kafka.topics.KafkaTopicDefinitions;
import com.orderpipeline.infra.kafka.topics.TopicNames;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.ContainerProperties;

@AutoConfiguration(
    beforeName = "org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration",
    afterName = {
      "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
      "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
    })
@EnableConfigurationProperties(InfraKafkaProperties.class)
public class InfraKafkaAutoConfiguration {
  @Bean
  @ConditionalOnMissingBean(name = "kafkaEventObjectMapper")
  public ObjectMapper kafkaEventObjectMapper() {
    return EventObjectMapperFactory.create();
  }

  @Bean
  @ConditionalOnMissingBean
  public DeadLetterMetadataCodec deadLetterMetadataCodec(
      @Qualifier("kafkaEventObjectMapper") ObjectMapper kafkaEventObjectMapper) {
    return new DeadLetterMetadataCodec(kafkaEventObjectMapper);
  }

  @Bean
  @ConditionalOnClass(MeterRegistry.class)
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(PipelineTelemetry.class)
  public PipelineTelemetry micrometerPipelineTelemetry(MeterRegistry meterRegistry) {
    return new MicrometerPipelineTelemetry(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(PipelineTelemetry.class)
  public PipelineTelemetry noOpPipelineTelemetry() {
    return new NoOpPipelineTelemetry();
  }

  @Bean
  @ConditionalOnMissingBean
  public EscalationPolicy escalationPolicy(InfraKafkaProperties properties) {
    return EscalationPolicyFactory.create(properties.getRetry());
  }

  @Bean
  @ConditionalOnMissingBean
  public TopicNames topicNames(InfraKafkaProperties properties) {
    return properties.getTopics().toTopicNames();
  }

  @Bean
  @ConditionalOnMissingBean(name = "infraKafkaProducerFactory")
  public ProducerFactory<String, byte[]> infraKafkaProducerFactory(
      InfraKafkaProperties properties) {
    InfraKafkaProperties.Producer producer = properties.getProducer();

    Map<String, Object> config = new HashMap<>();
    config.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, properties.bootstrapServersAsCsv());
    config.put(ProducerConfig.CLIENT_ID_CONFIG, producer.getClientId());
    config.put(ProducerConfig.ACKS_CONFIG, producer.getAcks());
    config.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, producer.isIdempotenceEnabled());
    config.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
    config.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);
    return new DefaultKafkaProducerFactory<>(config);
  }

  @Bean
  @ConditionalOnMissingBean(name = "infraKafkaTemplate")
  public KafkaTemplate<String, byte[]> infraKafkaTemplate(
      ProducerFactory<String, byte[]> infraKafkaProducerFactory) {
    return new KafkaTemplate<>(infraKafkaProducerFactory);
  }

  @Bean
  @ConditionalOnMissingBean
  public EnvelopePublisher envelopePublisher(
      KafkaTemplate<String, byte[]> infraKafkaTemplate,
      PipelineTelemetry pipelineTelemetry,
      InfraKafkaProperties properties) {
    long sendTimeoutMs = Math.max(0L, properties.getProducer().getSendTimeoutMs());
    return new KafkaEnvelopePublisher(
        infraKafkaTemplate, pipelineTelemetry, Duration.ofMillis(sendTimeoutMs));
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "infra.kafka.topics",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean(name = "infraKafkaTopics")
  public KafkaAdmin.NewTopics infraKafkaTopics(
      InfraKafkaProperties properties, TopicNames topicNames) {
    int partitions = Math.max(1, properties.getTopics().getPartitions());
    short replicationFactor = (short) Math.max(1, properties.getTopics().getReplicationFactor());
    NewTopic[] topics =
        KafkaTopicDefinitions.of(topicNames, partitions, replicationFactor).stream()
            .map(KafkaTopicDefinitions.KafkaTopicDefinition::toNewTopic)
            .toArray(NewTopic[]::new);
    return new KafkaAdmin.NewTopics(topics);
  }

  @Bean
  @ConditionalOnMissingBean(name = "infraKafkaConsumerFactory")
  public ConsumerFactory<String, byte[]> infraKafkaConsumerFactory(
      InfraKafkaProperties properties) {
    InfraKafkaProperties.Consumer consumer = properties.getConsumer();

    Map<String, Object> config = new HashMap<>();
    config.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, properties.bootstrapServersAsCsv());
    config.put(ConsumerConfig.GROUP_ID_CONFIG, consumer.getGroupId());
    config.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, consumer.getAutoOffsetReset());
    config.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
    config.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, Math.max(1, consumer.getMaxPollRecords()));
    config.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, consumer.getMaxPollIntervalMs());
    config.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
    config.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
    return new DefaultKafkaConsumerFactory<>(config);
  }

  @Bean(name = "infraKafkaListenerContainerFactory")
  @ConditionalOnMissingBean(name = "infraKafkaListenerContainerFactory")
  public ConcurrentKafkaListenerContainerFactory<String, byte[]>
      infraKafkaListenerContainerFactory(
          ConsumerFactory<String, byte[]> infraKafkaConsumerFactory,
          InfraKafkaProperties properties,
          TopicNames topicNames) {
    ConcurrentKafkaListenerContainerFactory<String, byte[]> factory =
        new ConcurrentKafkaListenerContainerFactory<>();
    factory.setConsumerFactory(infraKafkaConsumerFactory);
    factory.setConcurrency(Math.max(1, properties.getConsumer().getConcurrency()));
    factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL_IMMEDIATE);
    factory
        .getContainerProperties()
        .setConsumerRebalanceListener(
            new LatestOffsetRebalanceListener(List.of(topicNames.retry())));
    return factory;
  }
}
