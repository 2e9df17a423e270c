package com.orderpipeline.worker.codec;

import com.orderpipeline.domain.orders.Order;

public interface OrderCodec {
  Order decode(byte[] payload);

  byte[] encode(Order order);
}
