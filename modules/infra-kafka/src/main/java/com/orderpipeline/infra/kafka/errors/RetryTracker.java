package com.orderpipeline.infra.kafka.errors;

import com.orderpipeline.infra.kafka.contract.RetryHeaders;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads the retry counter carried in message headers. Anything other than plain ASCII digits
 * counts as "never retried".
 */
public final class RetryTracker {
  private static final Pattern ASCII_DIGITS = Pattern.compile("[0-9]+");

  private RetryTracker() {}

  public static int extractRetryCount(Map<String, String> headers) {
    if (headers == null) {
      return 0;
    }
    String raw = headers.get(RetryHeaders.RETRY_COUNT);
    if (raw == null) {
      return 0;
    }
    String trimmed = raw.trim();
    if (!ASCII_DIGITS.matcher(trimmed).matches()) {
      return 0;
    }
    try {
      return Integer.parseInt(trimmed);
    } catch (NumberFormatException ex) {
      return 0;
    }
  }

  public static int incrementRetryCount(Map<String, String> headers) {
    return extractRetryCount(headers) + 1;
  }
}
