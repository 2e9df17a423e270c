package com.orderpipeline.infra.kafka.errors;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class RetryTrackerTest {
  @Test
  void shouldReturnZeroWhenHeaderIsMissing() {
    assertEquals(0, RetryTracker.extractRetryCount(Map.of()));
    assertEquals(0, RetryTracker.extractRetryCount(Map.of("timestamp", "1700000000000")));
    assertEquals(0, RetryTracker.extractRetryCount(null));
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "", "  ", "abc", "1.5", "two", "-3", "+2", "\u0663", "\uFF12", "99999999999999999999"
      })
  void shouldTreatMalformedValuesAsNeverRetried(String raw) {
    assertEquals(0, RetryTracker.extractRetryCount(Map.of("retryCount", raw)));
  }

  @Test
  void shouldParseNumericValue() {
    assertEquals(2, RetryTracker.extractRetryCount(Map.of("retryCount", "2")));
    assertEquals(7, RetryTracker.extractRetryCount(Map.of("retryCount", " 7 ")));
  }

  @Test
  void shouldIncrementWithoutMutatingHeaders() {
    Map<String, String> headers = new HashMap<>();
    headers.put("retryCount", "1");

    assertEquals(2, RetryTracker.incrementRetryCount(headers));
    assertEquals("1", headers.get("retryCount"));
    assertEquals(1, RetryTracker.incrementRetryCount(Map.of()));
  }
}
