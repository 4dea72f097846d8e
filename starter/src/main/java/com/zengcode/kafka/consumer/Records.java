package com.zengcode.kafka.consumer;

import java.nio.charset.StandardCharsets;
import org.apache.kafka.clients.consumer.ConsumerRecord;

final class Records {

  private Records() {}

  static String key(ConsumerRecord<byte[], ?> record) {
    return record.key() == null ? "<null>" : new String(record.key(), StandardCharsets.UTF_8);
  }

  /** {@code key=..., partition=..., offset=...} fragment shared by every per-message log line. */
  static String describe(ConsumerRecord<byte[], ?> record) {
    return "key=" + key(record) + ", partition=" + record.partition() + ", offset=" + record.offset();
  }
}
