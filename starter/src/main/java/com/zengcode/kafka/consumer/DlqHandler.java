package com.zengcode.kafka.consumer;

import org.apache.kafka.clients.consumer.ConsumerRecord;

/**
 * Routes a message that cannot be processed to a dead-letter topic.
 *
 * <p>Implementations never throw: a failed publish is logged and the caller still commits the
 * source offset.
 */
public interface DlqHandler {

  void sendToDlq(ConsumerRecord<byte[], byte[]> record, Throwable error);
}
