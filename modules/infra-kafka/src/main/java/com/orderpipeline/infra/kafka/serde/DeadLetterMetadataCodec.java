package com.orderpipeline.infra.kafka.serde;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderpipeline.infra.kafka.contract.DeadLetterMetadata;
import java.util.Objects;

/** Converts {@link DeadLetterMetadata} to and from the JSON string stored in a header. */
public class DeadLetterMetadataCodec {
  private final ObjectMapper objectMapper;

  public DeadLetterMetadataCodec(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
  }

  public String encode(DeadLetterMetadata metadata) {
    try {
      return objectMapper.writeValueAsString(metadata);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to encode dead-letter metadata", ex);
    }
  }

  public DeadLetterMetadata decode(String json) {
    try {
      return objectMapper.readValue(json, DeadLetterMetadata.class);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to decode dead-letter metadata", ex);
    }
  }
}
