package com.orderpipeline.worker.processing;

import java.util.Objects;
import java.util.Random;

public class RandomFailureSource implements FailureSource {
  private final double probability;
  private final Random random;

  public RandomFailureSource(double probability, Random random) {
    if (Double.isNaN(probability) || probability < 0.0d || probability > 1.0d) {
      throw new IllegalArgumentException("probability must be between 0 and 1: " + probability);
    }
    this.probability = probability;
    this.random = Objects.requireNonNull(random, "random must not be null");
  }

  @Override
  public boolean shouldFail() {
    return random.nextDouble() < probability;
  }

  public double probability() {
    return probability;
  }
}
