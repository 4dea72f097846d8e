package com.zengcode.kafka.consumer;

import java.util.Objects;

/**
 * Binds a handler and its deserializer to the {@code kafka.pipeline.consumers[*]} entry with the
 * same name. Declare one bean per consumer.
 */
public final class ConsumerDefinition<T> {

  private final String name;
  private final EventDeserializer<T> deserializer;
  private final MessageHandler<T> handler;

  private ConsumerDefinition(String name, EventDeserializer<T> deserializer, MessageHandler<T> handler) {
    this.name = Objects.requireNonNull(name, "name");
    this.deserializer = Objects.requireNonNull(deserializer, "deserializer");
    this.handler = Objects.requireNonNull(handler, "handler");
  }

  public static <T> ConsumerDefinition<T> of(String name, EventDeserializer<T> deserializer, MessageHandler<T> handler) {
    return new ConsumerDefinition<>(name, deserializer, handler);
  }

  public String getName() {
    return name;
  }

  public EventDeserializer<T> getDeserializer() {
    return deserializer;
  }

  public MessageHandler<T> getHandler() {
    return handler;
  }
}
