package com.zengcode.kafka.consumer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Polls the broker and feeds the processor through the bounded channel. This is the only thread
 * that touches the client while the consumer runs, so it also commits stored offsets.
 */
final class Reader implements Runnable {

  private static final Logger log = LoggerFactory.getLogger(Reader.class);

  static final Duration POLL_TIMEOUT = Duration.ofSeconds(30);
  static final Duration ERROR_PAUSE = Duration.ofSeconds(1);
  private static final long OFFER_SLICE_MS = 100;

  private final Consumer<byte[], byte[]> client;
  private final BlockingQueue<ConsumerRecord<byte[], byte[]>> channel;
  private final CancellationToken token;
  private final ReadinessWaiter readiness;
  private final OffsetStore offsetStore;
  private final Duration pollTimeout;
  private final Duration commitInterval;
  private final Map<String, String> mdc;
  private final ErrorLogThrottler throttler = new ErrorLogThrottler(log);

  private long lastCommit;

  Reader(Consumer<byte[], byte[]> client, BlockingQueue<ConsumerRecord<byte[], byte[]>> channel,
         CancellationToken token, ReadinessWaiter readiness, OffsetStore offsetStore,
         Duration pollTimeout, Duration commitInterval, Map<String, String> mdc) {
    this.client = client;
    this.channel = channel;
    this.token = token;
    this.readiness = readiness;
    this.offsetStore = offsetStore;
    this.pollTimeout = pollTimeout;
    this.commitInterval = commitInterval;
    this.mdc = mdc;
  }

  @Override
  public void run() {
    MDC.setContextMap(mdc);
    try {
      if (!readiness.awaitTrafficReady(token)) {
        log.info("reader stopped before the service became ready for traffic");
        return;
      }
      log.info("service ready for traffic, starting to poll");
      lastCommit = System.nanoTime();
      pollLoop();
    } catch (WakeupException e) {
      log.debug("reader woken up for shutdown");
    } catch (RuntimeException e) {
      log.error("reader stopped unexpectedly, stopping consumer", e);
      token.cancel();
    } finally {
      log.info("reader stopped");
      MDC.clear();
    }
  }

  private void pollLoop() {
    while (!token.isCancelled()) {
      ConsumerRecords<byte[], byte[]> records;
      try {
        records = client.poll(pollTimeout);
      } catch (WakeupException e) {
        if (token.isCancelled()) {
          return;
        }
        continue;
      } catch (InterruptException e) {
        log.warn("reader interrupted while polling, stopping consumer");
        token.cancel();
        return;
      } catch (RuntimeException e) {
        if (!onPollError(e)) {
          return;
        }
        continue;
      }

      if (!records.isEmpty()) {
        throttler.reset();
        for (var record : records) {
          if (!forward(record)) {
            return;
          }
        }
      }
      maybeCommit();
    }
  }

  /** @return false when the reader has to stop */
  private boolean onPollError(RuntimeException e) {
    var classified = ErrorClassifier.classify(e);
    switch (classified.category()) {
      case FATAL:
        log.error("{}, stopping consumer", classified.description(), e);
        token.cancel();
        return false;
      case TIMEOUT:
        return true;
      case NON_BROKER:
        log.error("error while polling: {}", classified.description(), e);
        break;
      default:
        throttler.log(classified);
        break;
    }
    return !token.await(ERROR_PAUSE);
  }

  /** Blocks while the channel is full, but never past cancellation. */
  private boolean forward(ConsumerRecord<byte[], byte[]> record) {
    while (!token.isCancelled()) {
      try {
        if (channel.offer(record, OFFER_SLICE_MS, TimeUnit.MILLISECONDS)) {
          return true;
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("reader interrupted while forwarding message: {}", Records.describe(record));
        token.cancel();
        return false;
      }
      maybeCommit();
    }
    log.debug("dropping message read during shutdown: {}", Records.describe(record));
    return false;
  }

  private void maybeCommit() {
    var now = System.nanoTime();
    if (now - lastCommit < commitInterval.toNanos()) {
      return;
    }
    lastCommit = now;
    if (offsetStore.hasPending()) {
      offsetStore.commitAsync(client);
    }
  }

  ErrorLogThrottler throttler() {
    return throttler;
  }
}
