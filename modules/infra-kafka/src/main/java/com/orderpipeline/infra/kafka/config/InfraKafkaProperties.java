package com.orderpipeline.infra.kafka.config;

import com.orderpipeline.infra.kafka.topics.TopicNames;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "infra.kafka")
public class InfraKafkaProperties {
  private List<String> bootstrapServers = new ArrayList<>(List.of("localhost:9092"));
  private Producer producer = new Producer();
  private Consumer consumer = new Consumer();
  private Retry retry = new Retry();
  private Topics topics = new Topics();

  public List<String> getBootstrapServers() {
    return bootstrapServers;
  }

  public void setBootstrapServers(List<String> bootstrapServers) {
    this.bootstrapServers = bootstrapServers;
  }

  public Producer getProducer() {
    return producer;
  }

  public void setProducer(Producer producer) {
    this.producer = producer;
  }

  public Consumer getConsumer() {
    return consumer;
  }

  public void setConsumer(Consumer consumer) {
    this.consumer = consumer;
  }

  public Retry getRetry() {
    return retry;
  }

  public void setRetry(Retry retry) {
    this.retry = retry;
  }

  public Topics getTopics() {
    return topics;
  }

  public void setTopics(Topics topics) {
    this.topics = topics;
  }

  public String bootstrapServersAsCsv() {
    return String.join(",", bootstrapServers);
  }

  public static class Producer {
    private String clientId = "order-processing-system";
    private String acks = "all";
    private boolean idempotenceEnabled = true;
    private long sendTimeoutMs = 0L;

    public String getClientId() {
      return clientId;
    }

    public void setClientId(String clientId) {
      this.clientId = clientId;
    }

    public String getAcks() {
      return acks;
    }

    public void setAcks(String acks) {
      this.acks = acks;
    }

    public boolean isIdempotenceEnabled() {
      return idempotenceEnabled;
    }

    public void setIdempotenceEnabled(boolean idempotenceEnabled) {
      this.idempotenceEnabled = idempotenceEnabled;
    }

    public long getSendTimeoutMs() {
      return sendTimeoutMs;
    }

    public void setSendTimeoutMs(long sendTimeoutMs) {
      this.sendTimeoutMs = sendTimeoutMs;
    }
  }

  public static class Consumer {
    private String groupId = "order-consumer-group";
    private String autoOffsetReset = "earliest";
    // Every failed record may sleep for the retry delay before the next poll.
    private int maxPollRecords = 50;
    private int maxPollIntervalMs = 300000;
    private int concurrency = 1;

    public String getGroupId() {
      return groupId;
    }

    public void setGroupId(String groupId) {
      this.groupId = groupId;
    }

    public String getAutoOffsetReset() {
      return autoOffsetReset;
    }

    public void setAutoOffsetReset(String autoOffsetReset) {
      this.autoOffsetReset = autoOffsetReset;
    }

    public int getMaxPollRecords() {
      return maxPollRecords;
    }

    public void setMaxPollRecords(int maxPollRecords) {
      this.maxPollRecords = maxPollRecords;
    }

    public int getMaxPollIntervalMs() {
      return maxPollIntervalMs;
    }

    public void setMaxPollIntervalMs(int maxPollIntervalMs) {
      this.maxPollIntervalMs = maxPollIntervalMs;
    }

    public int getConcurrency() {
      return concurrency;
    }

    public void setConcurrency(int concurrency) {
      this.concurrency = concurrency;
    }
  }

  public static class Retry {
    private String mode = "fixed";
    private int maxRetries = 3;
    private long retryDelayMs = 2000L;
    private long maxRetryDelayMs = 30000L;
    private double multiplier = 2.0d;

    public String getMode() {
      return mode;
    }

    public void setMode(String mode) {
      this.mode = mode;
    }

    public int getMaxRetries() {
      return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
    }

    public long getRetryDelayMs() {
      return retryDelayMs;
    }

    public void setRetryDelayMs(long retryDelayMs) {
      this.retryDelayMs = retryDelayMs;
    }

    public long getMaxRetryDelayMs() {
      return maxRetryDelayMs;
    }

    public void setMaxRetryDelayMs(long maxRetryDelayMs) {
      this.maxRetryDelayMs = maxRetryDelayMs;
    }

    public double getMultiplier() {
      return multiplier;
    }

    public void setMultiplier(double multiplier) {
      this.multiplier = multiplier;
    }
  }

  public static class Topics {
    private boolean enabled = true;
    private int partitions = 1;
    private int replicationFactor = 1;
    private String primary = TopicNames.ORDERS;
    private String retry = TopicNames.ORDERS_RETRY;
    private String deadLetter = TopicNames.ORDERS_DLQ;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getPartitions() {
      return partitions;
    }

    public void setPartitions(int partitions) {
      this.partitions = partitions;
    }

    public int getReplicationFactor() {
      return replicationFactor;
    }

    public void setReplicationFactor(int replicationFactor) {
      this.replicationFactor = replicationFactor;
    }

    public String getPrimary() {
      return primary;
    }

    public void setPrimary(String primary) {
      this.primary = primary;
    }

    public String getRetry() {
      return retry;
    }

    public void setRetry(String retry) {
      this.retry = retry;
    }

    public String getDeadLetter() {
      return deadLetter;
    }

    public void setDeadLetter(String deadLetter) {
      this.deadLetter = deadLetter;
    }

    public TopicNames toTopicNames() {
      return new TopicNames(primary, retry, deadLetter);
    }
  }
}
