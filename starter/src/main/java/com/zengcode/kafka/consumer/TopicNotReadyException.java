package com.zengcode.kafka.consumer;

public class TopicNotReadyException extends RuntimeException {

  private final String topic;

  public TopicNotReadyException(String topic, String message, Throwable lastError) {
    super("topic " + topic + " is not ready: " + message, lastError);
    this.topic = topic;
  }

  public String getTopic() {
    return topic;
  }
}
