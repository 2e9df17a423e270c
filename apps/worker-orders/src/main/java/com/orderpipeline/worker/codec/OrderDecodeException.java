package com.orderpipeline.worker.codec;

/** Raised when an inbound payload cannot be turned into an order. */
public class OrderDecodeException extends RuntimeException {
  public OrderDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
