package com.orderpipeline.infra.kafka.producer;

import com.orderpipeline.infra.kafka.contract.MessageEnvelope;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.springframework.kafka.support.SendResult;

/**
 * Publishes raw payload bytes with string headers. Header pairs and payload bytes reach the broker
 * unchanged; failures complete the returned future with a {@link KafkaPublishException}.
 */
public interface EnvelopePublisher {
  CompletableFuture<SendResult<String, byte[]>> publish(
      String topic, String key, byte[] payload, Map<String, String> headers);

  default CompletableFuture<SendResult<String, byte[]>> publish(
      String topic, MessageEnvelope envelope) {
    return publish(topic, envelope.key(), envelope.payload(), envelope.headers());
  }
}
