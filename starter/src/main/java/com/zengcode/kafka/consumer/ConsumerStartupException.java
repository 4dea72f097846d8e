package com.zengcode.kafka.consumer;

public class ConsumerStartupException extends RuntimeException {

  public ConsumerStartupException(String message, Throwable cause) {
    super(message, cause);
  }
}
