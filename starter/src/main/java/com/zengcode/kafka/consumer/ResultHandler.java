package com.zengcode.kafka.consumer;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a {@link ProcessingOutcome} into side effects. Whatever the outcome, the offset is stored
 * exactly once, after the dead-letter publish if there is one.
 */
final class ResultHandler {

  private static final Logger log = LoggerFactory.getLogger(ResultHandler.class);

  private final DlqHandler dlqHandler;
  private final OffsetStore offsetStore;

  ResultHandler(DlqHandler dlqHandler, OffsetStore offsetStore) {
    this.dlqHandler = dlqHandler;
    this.offsetStore = offsetStore;
  }

  void handle(ProcessingOutcome outcome, ConsumerRecord<byte[], byte[]> record, Span span) {
    try {
      switch (outcome.kind()) {
        case SUCCESS:
          span.setStatus(StatusCode.OK, "message processed successfully");
          break;
        case SKIPPED:
          span.setStatus(StatusCode.OK, "message skipped");
          log.info("skipping message: {}, reason={}", Records.describe(record),
              outcome.cause() == null ? "" : outcome.cause().getMessage());
          break;
        case PERMANENT:
          span.setStatus(StatusCode.ERROR, "permanent error - sending to DLQ");
          log.error("permanent error - sending message to DLQ: {}", Records.describe(record), outcome.cause());
          dlqHandler.sendToDlq(record, outcome.cause());
          break;
        case EXHAUSTED:
          span.recordException(outcome.cause());
          span.setStatus(StatusCode.ERROR, "message processing failed - sending to DLQ");
          log.error("message processing failed after retries - sending to DLQ: {}", Records.describe(record),
              outcome.cause());
          dlqHandler.sendToDlq(record, outcome.cause());
          break;
        default:
          throw new IllegalStateException("unknown outcome " + outcome.kind());
      }
    } finally {
      storeOffset(record);
    }
  }

  // a store failure must not stall the partition
  private void storeOffset(ConsumerRecord<byte[], byte[]> record) {
    try {
      offsetStore.store(record);
    } catch (RuntimeException e) {
      log.error("failed to store offset: {}", Records.describe(record), e);
    }
  }
}
