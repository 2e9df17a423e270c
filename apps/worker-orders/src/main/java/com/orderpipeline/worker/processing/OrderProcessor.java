package com.orderpipeline.worker.processing;

import com.orderpipeline.domain.orders.Order;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** The fallible business step applied to every decoded order. */
public class OrderProcessor {
  static final String SIMULATED_FAILURE = "Simulated temporary processing error";

  private static final Logger log = LoggerFactory.getLogger(OrderProcessor.class);

  private final FailureSource failureSource;

  public OrderProcessor(FailureSource failureSource) {
    this.failureSource = Objects.requireNonNull(failureSource, "failureSource must not be null");
  }

  public ProcessingResult process(Order order) {
    Objects.requireNonNull(order, "order must not be null");
    if (failureSource.shouldFail()) {
      return ProcessingResult.failure(SIMULATED_FAILURE);
    }

    log.info(
        "Processing order order_id={} product={} price={}",
        order.id(),
        order.category(),
        order.amount());
    return ProcessingResult.success();
  }
}
