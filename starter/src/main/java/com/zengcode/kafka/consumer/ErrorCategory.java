package com.zengcode.kafka.consumer;

/** How the reader reacts to a failed poll. */
public enum ErrorCategory {
  /** Idle poll cadence, not an error. */
  TIMEOUT,
  /** The client can no longer be used; consumption stops. */
  FATAL,
  TOPIC_NOT_FOUND,
  BROKER_CONNECTION,
  LEADER_ELECTION,
  OTHER_RETRIABLE,
  NON_BROKER;

  public boolean isTerminal() {
    return this == TIMEOUT || this == FATAL;
  }

  /** Temporary broker conditions: keep polling, log with decaying verbosity. */
  public boolean isTemporary() {
    switch (this) {
      case TOPIC_NOT_FOUND:
      case BROKER_CONNECTION:
      case LEADER_ELECTION:
      case OTHER_RETRIABLE:
        return true;
      default:
        return false;
    }
  }
}
