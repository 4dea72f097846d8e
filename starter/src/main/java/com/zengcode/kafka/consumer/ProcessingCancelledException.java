package com.zengcode.kafka.consumer;

public class ProcessingCancelledException extends RuntimeException {

  public ProcessingCancelledException(String message) {
    super(message);
  }
}
