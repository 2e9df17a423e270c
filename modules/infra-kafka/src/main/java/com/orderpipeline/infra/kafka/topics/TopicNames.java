package com.orderpipeline.infra.kafka.topics;

import java.util.List;

/** The three topics a message can travel through. */
public record TopicNames(String primary, String retry, String deadLetter) {
  public static final String ORDERS = "orders";
  public static final String ORDERS_RETRY = "orders-retry";
  public static final String ORDERS_DLQ = "orders-dlq";

  public TopicNames {
    TopicNameValidator.assertValid(primary);
    TopicNameValidator.assertValid(retry);
    TopicNameValidator.assertValid(deadLetter);
    if (primary.equals(retry) || primary.equals(deadLetter) || retry.equals(deadLetter)) {
      throw new IllegalArgumentException(
          "primary, retry and dead-letter topics must be distinct: "
              + primary
              + ", "
              + retry
              + ", "
              + deadLetter);
    }
  }

  public static TopicNames defaults() {
    return new TopicNames(ORDERS, ORDERS_RETRY, ORDERS_DLQ);
  }

  public List<String> all() {
    return List.of(primary, retry, deadLetter);
  }
}
