package com.zengcode.kafka.consumer;

/** Invalid {@code kafka.pipeline.*} configuration, raised while the application context starts. */
public class ConsumerConfigException extends IllegalArgumentException {

  public ConsumerConfigException(String message) {
    super(message);
  }
}
