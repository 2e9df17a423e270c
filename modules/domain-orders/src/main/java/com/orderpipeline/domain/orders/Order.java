package com.orderpipeline.domain.orders;

import java.math.BigDecimal;

/**
 * Order decoded from an inbound message payload. Consumed once by the processing step and not
 * retained afterwards.
 */
public record Order(String id, String category, BigDecimal amount) {
  public Order {
    requireNonBlank(id, "id");
    requireNonBlank(category, "category");
    requirePositive(amount, "amount");
  }

  private static void requirePositive(BigDecimal value, String fieldName) {
    if (value == null || value.compareTo(BigDecimal.ZERO) <= 0) {
      throw new OrderDomainException(fieldName + " must be > 0");
    }
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new OrderDomainException(fieldName + " must not be blank");
    }
  }
}
