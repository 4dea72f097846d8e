package com.zengcode.kafka.consumer;

import org.apache.kafka.common.header.Headers;

/**
 * Turns a raw record value into a typed event. Failures are permanent: the record is dead-lettered
 * without retry. Throw {@link SkipMessageException} for event types this consumer ignores.
 */
@FunctionalInterface
public interface EventDeserializer<T> {

  T deserialize(byte[] data, Headers headers) throws Exception;
}
