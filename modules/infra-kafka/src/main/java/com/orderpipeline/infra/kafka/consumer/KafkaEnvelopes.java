package com.orderpipeline.infra.kafka.consumer;

import com.orderpipeline.infra.kafka.contract.MessageEnvelope;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;

/** Bridges Kafka records and {@link MessageEnvelope}. */
public final class KafkaEnvelopes {
  private static final byte[] EMPTY_PAYLOAD = new byte[0];

  private KafkaEnvelopes() {}

  /**
   * Copies key, value and headers out of a consumed record. Header values are read as UTF-8; when
   * a name repeats the last value wins, and headers without a value are skipped.
   */
  public static MessageEnvelope fromRecord(ConsumerRecord<String, byte[]> record) {
    Map<String, String> headers = new LinkedHashMap<>();
    for (Header header : record.headers()) {
      if (header.value() == null) {
        continue;
      }
      headers.put(header.key(), new String(header.value(), StandardCharsets.UTF_8));
    }
    byte[] payload = record.value() == null ? EMPTY_PAYLOAD : record.value();
    return new MessageEnvelope(record.key(), payload, headers);
  }
}
