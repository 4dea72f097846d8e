package com.zengcode.kafka.consumer;

import org.apache.kafka.clients.consumer.InvalidOffsetException;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.AuthenticationException;
import org.apache.kafka.common.errors.AuthorizationException;
import org.apache.kafka.common.errors.BrokerNotAvailableException;
import org.apache.kafka.common.errors.DisconnectException;
import org.apache.kafka.common.errors.FencedInstanceIdException;
import org.apache.kafka.common.errors.LeaderNotAvailableException;
import org.apache.kafka.common.errors.NetworkException;
import org.apache.kafka.common.errors.NotLeaderOrFollowerException;
import org.apache.kafka.common.errors.RetriableException;
import org.apache.kafka.common.errors.TimeoutException;
import org.apache.kafka.common.errors.UnknownTopicOrPartitionException;
import org.apache.kafka.common.errors.UnsupportedVersionException;

/**
 * Maps kafka-clients exceptions raised by {@code poll} onto {@link ErrorCategory}.
 *
 * <p>Order matters: several of the specific exceptions are {@link RetriableException}s too.
 */
public final class ErrorClassifier {

  private ErrorClassifier() {}

  public static ClassifiedError classify(Throwable error) {
    if (!(error instanceof KafkaException)) {
      return new ClassifiedError(error, ErrorCategory.NON_BROKER, "non_kafka_error", "non-Kafka error occurred");
    }
    if (error instanceof TimeoutException) {
      return new ClassifiedError(error, ErrorCategory.TIMEOUT, "", "");
    }
    if (isFatal(error)) {
      return new ClassifiedError(error, ErrorCategory.FATAL, "fatal",
          "fatal kafka error - consumer instance is no longer operable");
    }
    if (error instanceof UnknownTopicOrPartitionException) {
      return new ClassifiedError(error, ErrorCategory.TOPIC_NOT_FOUND, "topic_not_found",
          "topic not available, waiting for topic creation");
    }
    if (error instanceof NetworkException
        || error instanceof DisconnectException
        || error instanceof BrokerNotAvailableException) {
      return new ClassifiedError(error, ErrorCategory.BROKER_CONNECTION, "broker_connection",
          "broker connection issue, retrying");
    }
    if (error instanceof LeaderNotAvailableException || error instanceof NotLeaderOrFollowerException) {
      return new ClassifiedError(error, ErrorCategory.LEADER_ELECTION, "leader_election",
          "partition leader changing, retrying");
    }
    if (error instanceof RetriableException) {
      return new ClassifiedError(error, ErrorCategory.OTHER_RETRIABLE, "retriable_error",
          "retriable kafka error, retrying");
    }
    return new ClassifiedError(error, ErrorCategory.NON_BROKER, "unknown_error", "unknown kafka error");
  }

  private static boolean isFatal(Throwable error) {
    return error instanceof AuthenticationException
        || error instanceof AuthorizationException
        || error instanceof FencedInstanceIdException
        || error instanceof UnsupportedVersionException
        || error instanceof InvalidOffsetException;
  }
}
