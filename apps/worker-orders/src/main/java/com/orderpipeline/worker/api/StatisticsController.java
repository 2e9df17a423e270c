package com.orderpipeline.worker.api;

import com.orderpipeline.domain.orders.AggregateSnapshot;
import com.orderpipeline.domain.orders.OrderAggregator;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
public class StatisticsController {
  private final OrderAggregator orderAggregator;

  public StatisticsController(OrderAggregator orderAggregator) {
    this.orderAggregator = orderAggregator;
  }

  @GetMapping("/statistics")
  public StatisticsResponse statistics() {
    AggregateSnapshot snapshot = orderAggregator.snapshot();
    return new StatisticsResponse(snapshot.count(), snapshot.total(), snapshot.average());
  }
}
