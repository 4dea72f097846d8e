package com.zengcode.kafka.consumer;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offsets of handled records waiting for the next commit.
 *
 * <p>The processor stores, the thread that owns the client commits. The client is never touched
 * here outside of {@link #commitAsync} and {@link #commitSync}.
 */
public class OffsetStore {

  private static final Logger log = LoggerFactory.getLogger(OffsetStore.class);

  public enum CommitResult { COMMITTED, NOTHING_TO_COMMIT, FAILED }

  private final Map<TopicPartition, OffsetAndMetadata> pending = new ConcurrentHashMap<>();

  /** Marks {@code record} as handled: the next commit moves the group past it. */
  public void store(ConsumerRecord<?, ?> record) {
    pending.merge(new TopicPartition(record.topic(), record.partition()),
        new OffsetAndMetadata(record.offset() + 1), OffsetStore::latest);
  }

  public boolean hasPending() {
    return !pending.isEmpty();
  }

  Map<TopicPartition, OffsetAndMetadata> pending() {
    return Map.copyOf(pending);
  }

  /** Fire-and-forget commit from the polling thread; failed offsets go back into the store. */
  public void commitAsync(Consumer<?, ?> client) {
    var offsets = drain();
    if (offsets.isEmpty()) {
      return;
    }
    try {
      client.commitAsync(offsets, (committed, e) -> {
        if (e != null) {
          log.warn("failed to commit offsets {}", offsets, e);
          restore(offsets);
        } else {
          log.debug("committed offsets {}", committed);
        }
      });
    } catch (WakeupException e) {
      restore(offsets);
      throw e;
    } catch (KafkaException e) {
      log.warn("failed to commit offsets {}", offsets, e);
      restore(offsets);
    }
  }

  /**
   * Blocking commit of everything stored so far. An empty store is not an error: there is simply
   * nothing to commit.
   */
  public CommitResult commitSync(Consumer<?, ?> client) {
    var offsets = drain();
    if (offsets.isEmpty()) {
      log.debug("no stored offsets to commit");
      return CommitResult.NOTHING_TO_COMMIT;
    }
    try {
      client.commitSync(offsets);
      log.debug("committed offsets {}", offsets);
      return CommitResult.COMMITTED;
    } catch (WakeupException e) {
      restore(offsets);
      throw e;
    } catch (KafkaException e) {
      log.warn("failed to commit offsets {}", offsets, e);
      restore(offsets);
      return CommitResult.FAILED;
    }
  }

  private Map<TopicPartition, OffsetAndMetadata> drain() {
    var offsets = new HashMap<TopicPartition, OffsetAndMetadata>();
    for (var entry : pending.entrySet()) {
      if (pending.remove(entry.getKey(), entry.getValue())) {
        offsets.put(entry.getKey(), entry.getValue());
      }
    }
    return offsets;
  }

  private void restore(Map<TopicPartition, OffsetAndMetadata> offsets) {
    offsets.forEach((tp, offset) -> pending.merge(tp, offset, OffsetStore::latest));
  }

  private static OffsetAndMetadata latest(OffsetAndMetadata a, OffsetAndMetadata b) {
    return a.offset() >= b.offset() ? a : b;
  }
}
