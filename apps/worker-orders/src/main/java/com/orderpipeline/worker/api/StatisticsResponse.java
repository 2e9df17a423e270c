package com.orderpipeline.worker.api;

import java.math.BigDecimal;

public record StatisticsResponse(
    long totalOrders, BigDecimal runningTotal, BigDecimal runningAverage) {}
