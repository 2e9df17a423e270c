package com.orderpipeline.infra.kafka.contract;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MessageEnvelopeTest {
  @Test
  void shouldKeepPayloadBytesIsolatedFromCallers() {
    byte[] payload = "{\"orderId\":\"1\"}".getBytes(StandardCharsets.UTF_8);
    MessageEnvelope envelope = MessageEnvelope.of("order-1", payload);

    payload[0] = 'X';
    byte[] read = envelope.payload();
    read[1] = 'Y';

    assertArrayEquals(
        "{\"orderId\":\"1\"}".getBytes(StandardCharsets.UTF_8), envelope.payload());
  }

  @Test
  void shouldMergeHeadersIntoNewEnvelope() {
    MessageEnvelope original =
        new MessageEnvelope(
            "order-1", new byte[] {1, 2, 3}, Map.of("traceId", "abc", RetryHeaders.RETRY_COUNT, "1"));

    MessageEnvelope augmented =
        original.withHeaders(Map.of(RetryHeaders.RETRY_COUNT, "2", RetryHeaders.ERROR, "boom"));

    assertEquals("1", original.header(RetryHeaders.RETRY_COUNT));
    assertNull(original.header(RetryHeaders.ERROR));
    assertEquals("abc", augmented.header("traceId"));
    assertEquals("2", augmented.header(RetryHeaders.RETRY_COUNT));
    assertEquals("boom", augmented.header(RetryHeaders.ERROR));
    assertEquals("order-1", augmented.key());
    assertArrayEquals(new byte[] {1, 2, 3}, augmented.payload());
  }

  @Test
  void shouldCopyHeaderMapAndRejectMutation() {
    Map<String, String> headers = new HashMap<>();
    headers.put("a", "1");
    MessageEnvelope envelope = new MessageEnvelope(null, new byte[0], headers);

    headers.put("b", "2");

    assertEquals(Map.of("a", "1"), envelope.headers());
    assertThrows(UnsupportedOperationException.class, () -> envelope.headers().put("c", "3"));
  }

  @Test
  void shouldCompareByContent() {
    MessageEnvelope first = new MessageEnvelope("k", new byte[] {7}, Map.of("h", "v"));
    MessageEnvelope second = new MessageEnvelope("k", new byte[] {7}, Map.of("h", "v"));

    assertEquals(first, second);
    assertEquals(first.hashCode(), second.hashCode());
  }
}
