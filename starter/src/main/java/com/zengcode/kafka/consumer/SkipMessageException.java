package com.zengcode.kafka.consumer;

/**
 * Thrown by a {@link MessageHandler} or {@link EventDeserializer} to drop a message on purpose.
 * The message is not retried, not dead-lettered, and its offset is committed.
 */
public class SkipMessageException extends RuntimeException {

  public SkipMessageException(String message) {
    super(message);
  }

  public SkipMessageException(String message, Throwable cause) {
    super(message, cause);
  }
}
