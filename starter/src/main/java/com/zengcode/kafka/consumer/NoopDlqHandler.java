package com.zengcode.kafka.consumer;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Used when a consumer runs without a dead-letter topic. */
public final class NoopDlqHandler implements DlqHandler {

  private static final Logger log = LoggerFactory.getLogger(NoopDlqHandler.class);

  @Override
  public void sendToDlq(ConsumerRecord<byte[], byte[]> record, Throwable error) {
    log.warn("DLQ not configured, cannot send message to DLQ: {}", Records.describe(record));
  }
}
