package com.orderpipeline.infra.kafka.consumer;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import com.orderpipeline.infra.kafka.contract.MessageEnvelope;
import com.orderpipeline.infra.kafka.contract.RetryHeaders;
import java.nio.charset.StandardCharsets;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.Test;

class KafkaEnvelopesTest {
  @Test
  void shouldCopyKeyPayloadAndHeaders() {
    byte[] payload = "{\"orderId\":\"42\"}".getBytes(StandardCharsets.UTF_8);
    ConsumerRecord<String, byte[]> record = new ConsumerRecord<>("orders-retry", 0, 5L, "42", payload);
    record.headers().add(RetryHeaders.RETRY_COUNT, "2".getBytes(StandardCharsets.UTF_8));
    record.headers().add(RetryHeaders.ERROR, "boom".getBytes(StandardCharsets.UTF_8));

    MessageEnvelope envelope = KafkaEnvelopes.fromRecord(record);

    assertEquals("42", envelope.key());
    assertArrayEquals(payload, envelope.payload());
    assertEquals("2", envelope.header(RetryHeaders.RETRY_COUNT));
    assertEquals("boom", envelope.header(RetryHeaders.ERROR));
  }

  @Test
  void shouldKeepLastValueOfRepeatedHeaderAndSkipNullValues() {
    ConsumerRecord<String, byte[]> record = new ConsumerRecord<>("orders", 0, 0L, null, null);
    record.headers().add(RetryHeaders.RETRY_COUNT, "1".getBytes(StandardCharsets.UTF_8));
    record.headers().add(RetryHeaders.RETRY_COUNT, "3".getBytes(StandardCharsets.UTF_8));
    record.headers().add("empty", null);

    MessageEnvelope envelope = KafkaEnvelopes.fromRecord(record);

    assertEquals("3", envelope.header(RetryHeaders.RETRY_COUNT));
    assertFalse(envelope.headers().containsKey("empty"));
    assertEquals(0, envelope.payload().length);
  }
}
