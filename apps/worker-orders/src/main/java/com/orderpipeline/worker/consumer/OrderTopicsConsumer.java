package com.orderpipeline.worker.consumer;

import com.orderpipeline.infra.kafka.consumer.KafkaEnvelopes;
import com.orderpipeline.worker.dispatch.OrderDispatcher;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Single subscription over the primary and retry topics, so records from both are dispatched one
 * at a time on the same consumer thread and a retry backoff pauses both topics.
 *
 * <p>Partitions without a committed offset start from the earliest record, except on the retry
 * topic, which the infra container factory moves to the end.
 */
@Component
public class OrderTopicsConsumer {
  private final OrderDispatcher dispatcher;

  public OrderTopicsConsumer(OrderDispatcher dispatcher) {
    this.dispatcher = dispatcher;
  }

  @KafkaListener(
      id = "order-topics",
      topics = {
        "${infra.kafka.topics.primary:orders}",
        "${infra.kafka.topics.retry:orders-retry}"
      },
      groupId = "${infra.kafka.consumer.group-id:order-consumer-group}",
      containerFactory = "infraKafkaListenerContainerFactory",
      properties = "auto.offset.reset=earliest")
  public void onMessage(ConsumerRecord<String, byte[]> record, Acknowledgment ack) {
    dispatcher.dispatch(record.topic(), KafkaEnvelopes.fromRecord(record), ack::acknowledge);
  }
}
