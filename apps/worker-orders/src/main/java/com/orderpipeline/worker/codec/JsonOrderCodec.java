package com.orderpipeline.worker.codec;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderpipeline.domain.orders.Order;
import com.orderpipeline.domain.orders.OrderDomainException;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * Reads and writes the order payload produced upstream: {@code {"orderId", "product", "price"}}.
 * {@code product} maps to the order category and {@code price} to its amount.
 */
public class JsonOrderCodec implements OrderCodec {
  private final ObjectMapper objectMapper;

  public JsonOrderCodec(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
  }

  @Override
  public Order decode(byte[] payload) {
    if (payload == null || payload.length == 0) {
      throw new OrderDecodeException("Order payload is empty", null);
    }

    OrderPayload parsed;
    try {
      parsed = objectMapper.readValue(payload, OrderPayload.class);
    } catch (IOException ex) {
      throw new OrderDecodeException("Order payload is not valid JSON", ex);
    }
    if (parsed == null) {
      throw new OrderDecodeException("Order payload is null", null);
    }

    try {
      return new Order(parsed.orderId(), parsed.product(), parsed.price());
    } catch (OrderDomainException ex) {
      throw new OrderDecodeException("Order payload is invalid: " + ex.getMessage(), ex);
    }
  }

  @Override
  public byte[] encode(Order order) {
    Objects.requireNonNull(order, "order must not be null");
    try {
      return objectMapper.writeValueAsBytes(
          new OrderPayload(order.id(), order.category(), order.amount()));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to encode order " + order.id(), ex);
    }
  }

  @JsonPropertyOrder({"orderId", "product", "price"})
  record OrderPayload(String orderId, String product, BigDecimal price) {}
}
