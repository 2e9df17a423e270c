package com.orderpipeline.worker.api;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.orderpipeline.domain.orders.OrderAggregator;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class StatisticsControllerTest {
  @Test
  void shouldReturnZeroStatisticsBeforeAnyOrder() {
    StatisticsController controller = new StatisticsController(new OrderAggregator());

    StatisticsResponse response = controller.statistics();

    assertEquals(0L, response.totalOrders());
    assertEquals(BigDecimal.ZERO, response.runningTotal());
    assertEquals(BigDecimal.ZERO, response.runningAverage());
  }

  @Test
  void shouldReflectAggregatorSnapshot() {
    OrderAggregator aggregator = new OrderAggregator();
    aggregator.update(new BigDecimal("10.00"));
    aggregator.update(new BigDecimal("20.00"));
    StatisticsController controller = new StatisticsController(aggregator);

    StatisticsResponse response = controller.statistics();

    assertEquals(2L, response.totalOrders());
    assertEquals(0, new BigDecimal("30.00").compareTo(response.runningTotal()));
    assertEquals(0, new BigDecimal("15").compareTo(response.runningAverage()));
  }
}
