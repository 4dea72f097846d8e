package com.zengcode.kafka.consumer;

public class RetriesExhaustedException extends RuntimeException {

  private final int attempts;

  public RetriesExhaustedException(int attempts, Throwable lastFailure) {
    super("max retry attempts reached (" + attempts + "): " + lastFailure.getMessage(), lastFailure);
    this.attempts = attempts;
  }

  public int getAttempts() {
    return attempts;
  }
}
