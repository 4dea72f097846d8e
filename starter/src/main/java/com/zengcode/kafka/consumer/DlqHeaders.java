package com.zengcode.kafka.consumer;

/**
 * Forensic headers appended to every record routed to a dead-letter topic.
 * Together they are enough to replay a message without consulting logs.
 */
public final class DlqHeaders {
  public static final String ORIGINAL_TOPIC = "dlq.original.topic";
  public static final String ORIGINAL_PARTITION = "dlq.original.partition";
  public static final String ORIGINAL_OFFSET = "dlq.original.offset";
  public static final String ERROR = "dlq.error";
  public static final String ERROR_CLASS = "dlq.error.class";
  /** UTC, RFC 3339 with second precision. */
  public static final String TIMESTAMP = "dlq.timestamp";

  /** Header used by {@link JsonEventDeserializer} to pick the target type. */
  public static final String EVENT_TYPE = "event-type";

  private DlqHeaders() {}
}
