package com.orderpipeline.worker.processing;

/** Decides whether the next processing attempt fails. */
@FunctionalInterface
public interface FailureSource {
  boolean shouldFail();
}
