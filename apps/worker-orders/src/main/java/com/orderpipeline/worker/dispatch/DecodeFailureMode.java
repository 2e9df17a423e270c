package com.orderpipeline.worker.dispatch;

import java.util.Locale;

/** What the dispatcher does with a payload the codec rejects. */
public enum DecodeFailureMode {
  /** Rethrow to the listener container. */
  PROPAGATE,
  /** Publish straight to the dead-letter topic without consuming retry budget. */
  DEAD_LETTER;

  public static DecodeFailureMode from(String value) {
    if (value == null || value.isBlank()) {
      return PROPAGATE;
    }
    String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    for (DecodeFailureMode mode : values()) {
      if (mode.name().equals(normalized)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Unsupported pipeline.orders.decode-failure-mode: " + value);
  }
}
