package com.orderpipeline.domain.orders;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Running count, total and average over successfully processed orders.
 *
 * <p>Each update swaps in a new immutable {@link AggregateSnapshot}, so concurrent callers never
 * observe a count and total that belong to different updates. State lives only in memory and
 * starts from zero for every instance.
 */
public class OrderAggregator {
  private final AtomicReference<AggregateSnapshot> state =
      new AtomicReference<>(AggregateSnapshot.EMPTY);

  public AggregateSnapshot update(BigDecimal amount) {
    if (amount == null || amount.compareTo(BigDecimal.ZERO) <= 0) {
      throw new OrderDomainException("amount must be > 0");
    }
    return state.updateAndGet(current -> current.plus(amount));
  }

  public AggregateSnapshot snapshot() {
    return state.get();
  }
}
