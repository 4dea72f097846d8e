package com.zengcode.kafka.consumer;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.apache.kafka.clients.consumer.NoOffsetForPartitionException;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.AuthenticationException;
import org.apache.kafka.common.errors.BrokerNotAvailableException;
import org.apache.kafka.common.errors.CorruptRecordException;
import org.apache.kafka.common.errors.DisconnectException;
import org.apache.kafka.common.errors.GroupAuthorizationException;
import org.apache.kafka.common.errors.LeaderNotAvailableException;
import org.apache.kafka.common.errors.NetworkException;
import org.apache.kafka.common.errors.NotLeaderOrFollowerException;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.apache.kafka.common.errors.TimeoutException;
import org.apache.kafka.common.errors.UnknownTopicOrPartitionException;
import org.apache.kafka.common.errors.UnsupportedVersionException;
import org.junit.jupiter.api.Test;

class ErrorClassifierTest {

    @Test
    void timeout_is_terminal_but_not_fatal() {
        var classified = ErrorClassifier.classify(new TimeoutException("poll timed out"));

        assertThat(classified.category()).isEqualTo(ErrorCategory.TIMEOUT);
        assertThat(classified.isTimeout()).isTrue();
        assertThat(classified.isFatal()).isFalse();
        assertThat(classified.category().isTerminal()).isTrue();
    }

    @Test
    void client_level_failures_are_fatal() {
        assertThat(ErrorClassifier.classify(new AuthenticationException("bad credentials")).category())
                .isEqualTo(ErrorCategory.FATAL);
        assertThat(ErrorClassifier.classify(new GroupAuthorizationException("denied")).category())
                .isEqualTo(ErrorCategory.FATAL);
        assertThat(ErrorClassifier.classify(new UnsupportedVersionException("old broker")).category())
                .isEqualTo(ErrorCategory.FATAL);
        var noOffset = new NoOffsetForPartitionException(new TopicPartition("orders", 0));
        assertThat(ErrorClassifier.classify(noOffset).isFatal()).isTrue();
    }

    @Test
    void temporary_broker_conditions_get_their_own_tracking_key() {
        Map<Throwable, ErrorCategory> cases = Map.of(
                new UnknownTopicOrPartitionException("missing"), ErrorCategory.TOPIC_NOT_FOUND,
                new NetworkException("reset"), ErrorCategory.BROKER_CONNECTION,
                new DisconnectException("gone"), ErrorCategory.BROKER_CONNECTION,
                new BrokerNotAvailableException("down"), ErrorCategory.BROKER_CONNECTION,
                new LeaderNotAvailableException("electing"), ErrorCategory.LEADER_ELECTION,
                new NotLeaderOrFollowerException("moved"), ErrorCategory.LEADER_ELECTION,
                new CorruptRecordException("crc"), ErrorCategory.OTHER_RETRIABLE);

        cases.forEach((error, expected) -> {
            var classified = ErrorClassifier.classify(error);
            assertThat(classified.category()).as(error.toString()).isEqualTo(expected);
            assertThat(classified.isTemporary()).isTrue();
            assertThat(classified.trackingKey()).isNotBlank();
        });
    }

    @Test
    void unknown_kafka_errors_and_plain_exceptions_are_non_broker_with_distinct_keys() {
        var unknownKafka = ErrorClassifier.classify(new RecordTooLargeException("too big"));
        var plain = ErrorClassifier.classify(new IllegalStateException("not subscribed"));

        assertThat(unknownKafka.category()).isEqualTo(ErrorCategory.NON_BROKER);
        assertThat(plain.category()).isEqualTo(ErrorCategory.NON_BROKER);
        assertThat(unknownKafka.trackingKey()).isNotEqualTo(plain.trackingKey());
        assertThat(ErrorClassifier.classify(new KafkaException("generic")).category())
                .isEqualTo(ErrorCategory.NON_BROKER);
    }
}
