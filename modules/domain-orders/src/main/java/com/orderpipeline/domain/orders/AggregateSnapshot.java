package com.orderpipeline.domain.orders;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Objects;

/** Point-in-time view of the running aggregate. {@code average} is zero while count is zero. */
public record AggregateSnapshot(long count, BigDecimal total, BigDecimal average) {
  public static final AggregateSnapshot EMPTY =
      new AggregateSnapshot(0L, BigDecimal.ZERO, BigDecimal.ZERO);

  public AggregateSnapshot {
    if (count < 0) {
      throw new OrderDomainException("count must be >= 0");
    }
    Objects.requireNonNull(total, "total must not be null");
    Objects.requireNonNull(average, "average must not be null");
  }

  AggregateSnapshot plus(BigDecimal amount) {
    long nextCount = count + 1;
    BigDecimal nextTotal = total.add(amount);
    BigDecimal nextAverage = nextTotal.divide(BigDecimal.valueOf(nextCount), MathContext.DECIMAL64);
    return new AggregateSnapshot(nextCount, nextTotal, nextAverage);
  }
}
