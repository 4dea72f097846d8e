package com.zengcode.kafka.consumer;

import java.time.Duration;

/** A single handler attempt ran past the processing timeout. Retried like any transient error. */
public class ProcessingTimeoutException extends RuntimeException {

  public ProcessingTimeoutException(Duration timeout) {
    super("message processing timed out after " + timeout.toMillis() + "ms");
  }
}
