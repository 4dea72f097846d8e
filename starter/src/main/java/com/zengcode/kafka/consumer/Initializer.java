package com.zengcode.kafka.consumer;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subscribes the client and waits until the topic has partition metadata.
 *
 * <p>A readiness timeout of zero waits until the topic shows up or the token is cancelled. When
 * the deadline passes the consumer either fails to start or starts degraded, depending on
 * {@code failOnTopicError}.
 */
final class Initializer {

  private static final Logger log = LoggerFactory.getLogger(Initializer.class);

  static final Duration RETRY_INTERVAL = Duration.ofSeconds(5);
  static final Duration MAX_METADATA_CALL = Duration.ofSeconds(5);

  private final Consumer<?, ?> client;
  private final String topic;
  private final Duration readinessTimeout;
  private final boolean failOnTopicError;
  private final ConsumerRebalanceListener rebalanceListener;
  private final Duration retryInterval;

  Initializer(Consumer<?, ?> client, String topic, Duration readinessTimeout, boolean failOnTopicError,
              ConsumerRebalanceListener rebalanceListener, Duration retryInterval) {
    this.client = client;
    this.topic = topic;
    this.readinessTimeout = readinessTimeout;
    this.failOnTopicError = failOnTopicError;
    this.rebalanceListener = rebalanceListener;
    this.retryInterval = retryInterval;
  }

  void initialize(CancellationToken token) {
    client.subscribe(List.of(topic), rebalanceListener);
    log.info("subscribed to topic {}, waiting for topic metadata (timeout={})", topic,
        readinessTimeout.isZero() ? "unbounded" : readinessTimeout);

    var unbounded = readinessTimeout.isZero();
    var deadline = System.nanoTime() + (unbounded ? 0 : readinessTimeout.toNanos());
    Throwable lastError = null;
    var lastReason = "no metadata received";

    while (!token.isCancelled()) {
      var remaining = unbounded ? MAX_METADATA_CALL : Duration.ofNanos(deadline - System.nanoTime());
      if (remaining.isNegative() || remaining.isZero()) {
        break;
      }

      try {
        var partitions = client.partitionsFor(topic, min(MAX_METADATA_CALL, remaining));
        if (partitions != null && !partitions.isEmpty()) {
          log.info("topic {} is ready with {} partition(s)", topic, partitions.size());
          return;
        }
        lastError = null;
        lastReason = "topic not found or has no partitions";
      } catch (WakeupException e) {
        lastReason = "woken up while fetching metadata";
      } catch (KafkaException e) {
        lastError = e;
        lastReason = "topic metadata error: " + e.getMessage();
      }
      log.debug("topic {} not ready yet: {}", topic, lastReason);

      var pause = unbounded ? retryInterval : min(retryInterval, Duration.ofNanos(deadline - System.nanoTime()));
      if (!pause.isNegative() && token.await(pause)) {
        break;
      }
    }

    if (token.isCancelled()) {
      throw new TopicNotReadyException(topic, "cancelled while waiting for topic metadata", lastError);
    }
    if (failOnTopicError) {
      throw new TopicNotReadyException(topic, "not ready after " + readinessTimeout + ": " + lastReason, lastError);
    }
    log.warn("topic {} not ready after {} ({}), starting anyway", topic, readinessTimeout, lastReason);
  }

  private static Duration min(Duration a, Duration b) {
    return a.compareTo(b) <= 0 ? a : b;
  }

  /** Logs assignment changes and flushes stored offsets before partitions are taken away. */
  static final class CommittingRebalanceListener implements ConsumerRebalanceListener {

    private final Consumer<?, ?> client;
    private final OffsetStore offsetStore;

    CommittingRebalanceListener(Consumer<?, ?> client, OffsetStore offsetStore) {
      this.client = client;
      this.offsetStore = offsetStore;
    }

    @Override
    public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
      log.info("partitions revoked: {}", partitions);
      if (!partitions.isEmpty() && offsetStore.hasPending()) {
        offsetStore.commitSync(client);
      }
    }

    @Override
    public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
      log.info("partitions assigned: {}", partitions);
    }
  }
}
