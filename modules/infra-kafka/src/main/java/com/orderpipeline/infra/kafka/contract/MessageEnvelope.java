package com.orderpipeline.infra.kafka.contract;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Key, opaque payload and string headers of a single message. Instances are immutable: header
 * augmentation returns a new envelope that shares the key and a copy of the payload bytes.
 */
public final class MessageEnvelope {
  private final String key;
  private final byte[] payload;
  private final Map<String, String> headers;

  public MessageEnvelope(String key, byte[] payload, Map<String, String> headers) {
    this.key = key;
    this.payload = Objects.requireNonNull(payload, "payload must not be null").clone();
    this.headers =
        Collections.unmodifiableMap(
            new LinkedHashMap<>(Objects.requireNonNull(headers, "headers must not be null")));
  }

  public static MessageEnvelope of(String key, byte[] payload) {
    return new MessageEnvelope(key, payload, Map.of());
  }

  public String key() {
    return key;
  }

  public byte[] payload() {
    return payload.clone();
  }

  public Map<String, String> headers() {
    return headers;
  }

  public String header(String name) {
    return headers.get(name);
  }

  public MessageEnvelope withHeaders(Map<String, String> additionalHeaders) {
    Objects.requireNonNull(additionalHeaders, "additionalHeaders must not be null");
    Map<String, String> merged = new LinkedHashMap<>(headers);
    merged.putAll(additionalHeaders);
    return new MessageEnvelope(key, payload, merged);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof MessageEnvelope that)) {
      return false;
    }
    return Objects.equals(key, that.key)
        && Arrays.equals(payload, that.payload)
        && headers.equals(that.headers);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(key, headers) + Arrays.hashCode(payload);
  }

  @Override
  public String toString() {
    return "MessageEnvelope[key=" + key + ", payloadBytes=" + payload.length + ", headers="
        + headers + "]";
  }
}
