package com.zengcode.kafka.consumer;

/**
 * Non-retryable failure: the message can never be processed (invalid payload, business rule
 * violation, bug). It goes straight to the dead-letter topic and its offset is committed.
 */
public class PermanentProcessingException extends RuntimeException {

  public PermanentProcessingException(String message) {
    super(message);
  }

  public PermanentProcessingException(String message, Throwable cause) {
    super(message, cause);
  }
}
