package com.zengcode.kafka.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.apache.kafka.common.header.Headers;

/**
 * Jackson based {@link EventDeserializer}. Picks the target class from the {@code event-type}
 * header; records with a missing or unmapped type are skipped.
 */
public final class JsonEventDeserializer<T> implements EventDeserializer<T> {

  private final ObjectMapper mapper;
  private final Map<String, Class<? extends T>> types;
  private final Class<? extends T> fixedType;

  private JsonEventDeserializer(ObjectMapper mapper, Map<String, Class<? extends T>> types, Class<? extends T> fixedType) {
    this.mapper = mapper;
    this.types = Map.copyOf(types);
    this.fixedType = fixedType;
  }

  /** Resolves the target type through the {@code event-type} header. */
  public static <T> JsonEventDeserializer<T> byEventType(ObjectMapper mapper, Map<String, Class<? extends T>> types) {
    return new JsonEventDeserializer<>(mapper, types, null);
  }

  /** Always reads {@code type}, whatever the headers say. */
  public static <T> JsonEventDeserializer<T> of(ObjectMapper mapper, Class<T> type) {
    return new JsonEventDeserializer<>(mapper, Map.of(), type);
  }

  @Override
  public T deserialize(byte[] data, Headers headers) throws IOException {
    var type = fixedType != null ? fixedType : resolve(headers);
    if (data == null) {
      throw new PermanentProcessingException("record has no value to deserialize");
    }
    return mapper.readValue(data, type);
  }

  private Class<? extends T> resolve(Headers headers) {
    var eventType = eventType(headers);
    if (eventType == null) {
      throw new SkipMessageException("record has no " + DlqHeaders.EVENT_TYPE + " header");
    }
    var type = types.get(eventType);
    if (type == null) {
      throw new SkipMessageException("unsupported event type: " + eventType);
    }
    return type;
  }

  /** Value of the {@code event-type} header, or null. */
  public static String eventType(Headers headers) {
    var header = headers == null ? null : headers.lastHeader(DlqHeaders.EVENT_TYPE);
    return header == null || header.value() == null ? null : new String(header.value(), StandardCharsets.UTF_8);
  }
}
