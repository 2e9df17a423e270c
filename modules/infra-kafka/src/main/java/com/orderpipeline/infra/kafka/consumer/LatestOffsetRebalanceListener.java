package com.orderpipeline.infra.kafka.consumer;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.listener.ConsumerAwareRebalanceListener;

/**
 * Starts the given topics from their log end when the group has no committed offset for an
 * assigned partition. Partitions of other topics keep the consumer's {@code auto.offset.reset}.
 */
public class LatestOffsetRebalanceListener implements ConsumerAwareRebalanceListener {
  private static final Logger log = LoggerFactory.getLogger(LatestOffsetRebalanceListener.class);

  private final Set<String> topics;

  public LatestOffsetRebalanceListener(Collection<String> topics) {
    Objects.requireNonNull(topics, "topics must not be null");
    this.topics = Set.copyOf(topics);
  }

  @Override
  public void onPartitionsAssigned(Consumer<?, ?> consumer, Collection<TopicPartition> partitions) {
    Set<TopicPartition> candidates =
        partitions.stream()
            .filter(partition -> topics.contains(partition.topic()))
            .collect(Collectors.toCollection(LinkedHashSet::new));
    if (candidates.isEmpty()) {
      return;
    }

    Map<TopicPartition, OffsetAndMetadata> committed = consumer.committed(candidates);
    List<TopicPartition> uncommitted =
        candidates.stream().filter(partition -> committed.get(partition) == null).toList();
    if (uncommitted.isEmpty()) {
      return;
    }
    consumer.seekToEnd(uncommitted);
    log.info("Starting uncommitted partitions from log end partitions={}", uncommitted);
  }
}
