package com.zengcode.kafka.consumer;

/**
 * Business logic for one consumer.
 *
 * <p>Throw {@link SkipMessageException} to drop the event, {@link PermanentProcessingException} to
 * dead-letter it right away. Any other exception is retried with backoff until the attempt budget
 * runs out. An {@link Error} is treated as a bug and dead-lettered without retry.
 */
@FunctionalInterface
public interface MessageHandler<T> {

  void handle(T event) throws Exception;
}
