package com.zengcode.kafka.consumer;

/**
 * Process-wide gate that keeps readers from polling before the service can handle the side effects
 * of processing.
 */
@FunctionalInterface
public interface ReadinessWaiter {

  /** Gate that is always open. */
  ReadinessWaiter IMMEDIATE = token -> !token.isCancelled();

  /**
   * Blocks until the service is ready to take traffic.
   *
   * @return false if {@code token} was cancelled while waiting
   */
  boolean awaitTrafficReady(CancellationToken token);
}
