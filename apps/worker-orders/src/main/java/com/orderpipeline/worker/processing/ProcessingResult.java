package com.orderpipeline.worker.processing;

public record ProcessingResult(boolean succeeded, String failureReason) {
  private static final ProcessingResult SUCCESS = new ProcessingResult(true, null);

  public ProcessingResult {
    if (!succeeded && (failureReason == null || failureReason.isBlank())) {
      throw new IllegalArgumentException("failureReason must not be blank for a failed result");
    }
  }

  public static ProcessingResult success() {
    return SUCCESS;
  }

  public static ProcessingResult failure(String reason) {
    return new ProcessingResult(false, reason);
  }
}
