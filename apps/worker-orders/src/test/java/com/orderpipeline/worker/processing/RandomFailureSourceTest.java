package com.orderpipeline.worker.processing;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;
import org.junit.jupiter.api.Test;

class RandomFailureSourceTest {
  @Test
  void shouldNeverFailWithZeroProbability() {
    RandomFailureSource source = new RandomFailureSource(0.0d, new Random(7L));

    for (int i = 0; i < 1_000; i++) {
      assertFalse(source.shouldFail());
    }
  }

  @Test
  void shouldAlwaysFailWithProbabilityOne() {
    RandomFailureSource source = new RandomFailureSource(1.0d, new Random(7L));

    for (int i = 0; i < 1_000; i++) {
      assertTrue(source.shouldFail());
    }
  }

  @Test
  void shouldFailRoughlyAtConfiguredRate() {
    RandomFailureSource source = new RandomFailureSource(0.1d, new Random(42L));

    int failures = 0;
    for (int i = 0; i < 10_000; i++) {
      if (source.shouldFail()) {
        failures++;
      }
    }

    assertTrue(failures > 800 && failures < 1_200, "failures=" + failures);
  }

  @Test
  void shouldRejectOutOfRangeProbability() {
    assertThrows(IllegalArgumentException.class, () -> new RandomFailureSource(-0.1d, new Random()));
    assertThrows(IllegalArgumentException.class, () -> new RandomFailureSource(1.5d, new Random()));
    assertThrows(
        IllegalArgumentException.class, () -> new RandomFailureSource(Double.NaN, new Random()));
  }
}
