package com.orderpipeline.worker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pipeline.orders")
public class OrderPipelineProperties {
  private double failureProbability = 0.1d;
  private String decodeFailureMode = "propagate";

  public double getFailureProbability() {
    return failureProbability;
  }

  public void setFailureProbability(double failureProbability) {
    this.failureProbability = failureProbability;
  }

  public String getDecodeFailureMode() {
    return decodeFailureMode;
  }

  public void setDecodeFailureMode(String decodeFailureMode) {
    this.decodeFailureMode = decodeFailureMode;
  }
}
