package com.orderpipeline.infra.kafka.consumer;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.Test;

class LatestOffsetRebalanceListenerTest {
  private static final TopicPartition ORDERS_0 = new TopicPartition("orders", 0);
  private static final TopicPartition RETRY_0 = new TopicPartition("orders-retry", 0);
  private static final TopicPartition RETRY_1 = new TopicPartition("orders-retry", 1);

  private final LatestOffsetRebalanceListener listener =
      new LatestOffsetRebalanceListener(List.of("orders-retry"));

  @Test
  @SuppressWarnings("unchecked")
  void shouldSeekToEndOnlyForUncommittedRetryPartitions() {
    Consumer<String, byte[]> consumer = mock(Consumer.class);
    when(consumer.committed(Set.of(RETRY_0, RETRY_1)))
        .thenReturn(Map.of(RETRY_0, new OffsetAndMetadata(7L)));

    listener.onPartitionsAssigned(consumer, List.of(ORDERS_0, RETRY_0, RETRY_1));

    verify(consumer).seekToEnd(List.of(RETRY_1));
  }

  @Test
  @SuppressWarnings("unchecked")
  void shouldLeaveCommittedRetryPartitionsAlone() {
    Consumer<String, byte[]> consumer = mock(Consumer.class);
    when(consumer.committed(Set.of(RETRY_0)))
        .thenReturn(Map.of(RETRY_0, new OffsetAndMetadata(3L)));

    listener.onPartitionsAssigned(consumer, List.of(ORDERS_0, RETRY_0));

    verify(consumer, never()).seekToEnd(anyCollection());
  }

  @Test
  @SuppressWarnings("unchecked")
  void shouldNotQueryOffsetsWhenNoRetryPartitionIsAssigned() {
    Consumer<String, byte[]> consumer = mock(Consumer.class);

    listener.onPartitionsAssigned(consumer, List.of(ORDERS_0));

    verify(consumer, never()).committed(any(Set.class));
    verify(consumer, never()).seekToEnd(anyCollection());
  }
}
