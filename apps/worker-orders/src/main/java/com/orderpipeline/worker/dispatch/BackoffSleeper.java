package com.orderpipeline.worker.dispatch;

import java.time.Duration;

/** Blocks the dispatching thread between a retry publish and the next record. */
@FunctionalInterface
public interface BackoffSleeper {
  void sleep(Duration delay) throws InterruptedException;

  static BackoffSleeper threadSleep() {
    return delay -> {
      long waitMillis = delay == null ? 0L : Math.max(0L, delay.toMillis());
      if (waitMillis > 0L) {
        Thread.sleep(waitMillis);
      }
    };
  }
}
