package com.zengcode.kafka.consumer;

/**
 * A poll failure together with its category.
 *
 * @param error the original exception
 * @param category reader branch to take
 * @param trackingKey key used to throttle repeated logs of the same kind
 * @param description human readable summary used as the log message
 */
public record ClassifiedError(Throwable error, ErrorCategory category, String trackingKey, String description) {

  public boolean isFatal() {
    return category == ErrorCategory.FATAL;
  }

  public boolean isTimeout() {
    return category == ErrorCategory.TIMEOUT;
  }

  public boolean isTemporary() {
    return category.isTemporary();
  }
}
