package com.zengcode.kafka.consumer;

import io.opentelemetry.context.Context;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Takes records off the channel one at a time and drives each through decode, handle and result
 * handling inside its own consume span.
 */
final class Processor<T> implements Runnable {

  private static final Logger log = LoggerFactory.getLogger(Processor.class);

  private static final long TAKE_SLICE_MS = 100;

  private final BlockingQueue<ConsumerRecord<byte[], byte[]>> channel;
  private final CancellationToken token;
  private final MessageTracer tracer;
  private final RetryExecutor retryExecutor;
  private final ResultHandler resultHandler;
  private final EventDeserializer<T> deserializer;
  private final MessageHandler<T> handler;
  private final Map<String, String> mdc;

  Processor(BlockingQueue<ConsumerRecord<byte[], byte[]>> channel, CancellationToken token, MessageTracer tracer,
            RetryExecutor retryExecutor, ResultHandler resultHandler, EventDeserializer<T> deserializer,
            MessageHandler<T> handler, Map<String, String> mdc) {
    this.channel = channel;
    this.token = token;
    this.tracer = tracer;
    this.retryExecutor = retryExecutor;
    this.resultHandler = resultHandler;
    this.deserializer = deserializer;
    this.handler = handler;
    this.mdc = mdc;
  }

  @Override
  public void run() {
    MDC.setContextMap(mdc);
    try {
      while (!token.isCancelled()) {
        var record = channel.poll(TAKE_SLICE_MS, TimeUnit.MILLISECONDS);
        if (record == null) {
          continue;
        }
        // not stored, so it is redelivered after restart
        if (token.isCancelled()) {
          log.debug("dropping message taken during shutdown: {}", Records.describe(record));
          break;
        }
        process(record);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("processor interrupted, stopping consumer");
      token.cancel();
    } finally {
      log.info("processor stopped");
      MDC.clear();
    }
  }

  void process(ConsumerRecord<byte[], byte[]> record) {
    var parent = tracer.extractContext(Context.root(), record);
    var span = tracer.startConsumerSpan(parent, record);
    try (var ignored = parent.with(span).makeCurrent()) {
      var outcome = retryExecutor.execute(token, new Delivery(record));
      resultHandler.handle(outcome, record, span);
    } catch (RuntimeException e) {
      log.error("unexpected failure while handling result: {}", Records.describe(record), e);
    } finally {
      span.end();
    }
  }

  /** One message's attempts. The payload is decoded by the first attempt and reused after. */
  private final class Delivery implements RetryExecutor.Attempt {

    private final ConsumerRecord<byte[], byte[]> record;
    private volatile T event;
    private volatile boolean decoded;

    private Delivery(ConsumerRecord<byte[], byte[]> record) {
      this.record = record;
    }

    @Override
    public void run() throws Exception {
      if (!decoded) {
        event = decode();
        decoded = true;
      }
      handler.handle(event);
    }

    private T decode() {
      try {
        return deserializer.deserialize(record.value(), record.headers());
      } catch (SkipMessageException | PermanentProcessingException e) {
        throw e;
      } catch (Exception e) {
        throw new PermanentProcessingException("failed to deserialize message: " + e.getMessage(), e);
      }
    }
  }
}
