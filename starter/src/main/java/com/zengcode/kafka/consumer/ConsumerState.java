package com.zengcode.kafka.consumer;

/** Lifecycle of a {@link ReliableKafkaConsumer}. Transitions only move forward. */
public enum ConsumerState {
  NOT_STARTED,
  STARTING,
  RUNNING,
  STOPPING,
  STOPPED
}
