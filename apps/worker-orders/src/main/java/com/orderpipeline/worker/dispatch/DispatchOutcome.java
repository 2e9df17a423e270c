package com.orderpipeline.worker.dispatch;

public enum DispatchOutcome {
  SUCCEEDED,
  RETRIED,
  DEAD_LETTERED
}
