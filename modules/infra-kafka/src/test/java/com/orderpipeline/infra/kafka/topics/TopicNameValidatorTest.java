package com.orderpipeline.infra.kafka.topics;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class TopicNameValidatorTest {
  @Test
  void shouldAcceptPipelineTopicNames() {
    assertDoesNotThrow(() -> TopicNameValidator.assertValid(TopicNames.ORDERS));
    assertDoesNotThrow(() -> TopicNameValidator.assertValid(TopicNames.ORDERS_RETRY));
    assertDoesNotThrow(() -> TopicNameValidator.assertValid(TopicNames.ORDERS_DLQ));
    assertTrue(TopicNameValidator.isValid("orders.submitted_v1"));
  }

  @Test
  void shouldRejectIllegalTopicNames() {
    assertFalse(TopicNameValidator.isValid(null));
    assertFalse(TopicNameValidator.isValid(""));
    assertFalse(TopicNameValidator.isValid("."));
    assertFalse(TopicNameValidator.isValid(".."));
    assertFalse(TopicNameValidator.isValid("orders retry"));
    assertFalse(TopicNameValidator.isValid("orders/dlq"));
    assertFalse(TopicNameValidator.isValid("o".repeat(250)));
    assertThrows(IllegalArgumentException.class, () -> TopicNameValidator.assertValid("bad topic"));
  }
}
