package com.zengcode.kafka.consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.function.Consumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class KafkaPipelinePropertiesTest {

    private KafkaPipelineProperties props;

    @BeforeEach
    void setUp() {
        props = new KafkaPipelineProperties();
        props.getDefaults().setGroupId("order-service");
    }

    private KafkaPipelineProperties.ConsumerProperties consumer(String name, String topic,
                                                                Consumer<KafkaPipelineProperties.ConsumerProperties> custom) {
        var c = new KafkaPipelineProperties.ConsumerProperties();
        c.setName(name);
        c.setTopic(topic);
        custom.accept(c);
        props.getConsumers().add(c);
        return c;
    }

    @Test
    void unset_fields_inherit_defaults() {
        consumer("orders", "orders", c -> { });

        var settings = props.resolve().get(0);

        assertThat(settings.groupId()).isEqualTo("order-service");
        assertThat(settings.autoOffsetReset()).isEqualTo("latest");
        assertThat(settings.maxRetryAttempts()).isEqualTo(3);
        assertThat(settings.initialBackoff()).isEqualTo(Duration.ofSeconds(1));
        assertThat(settings.maxBackoff()).isEqualTo(Duration.ofSeconds(30));
        assertThat(settings.processingTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(settings.channelBufferSize()).isEqualTo(100);
        assertThat(settings.readinessTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(settings.failOnTopicError()).isFalse();
        assertThat(settings.commitInterval()).isEqualTo(Duration.ofSeconds(3));
        assertThat(settings.enableDlq()).isTrue();
        assertThat(settings.dlqTopic()).isEqualTo("orders.dlq");
    }

    @Test
    void consumer_values_override_defaults() {
        props.getDefaults().setMaxRetryAttempts(5);
        consumer("payments", "payments", c -> {
            c.setGroupId("payment-service");
            c.setAutoOffsetReset("EARLIEST");
            c.setMaxRetryAttempts(7);
            c.setReadinessTimeoutSeconds(0);
            c.setFailOnTopicError(true);
            c.setDlqTopic("payments-dead");
        });
        consumer("refunds", "refunds", c -> c.setEnableDlq(false));

        var resolved = props.resolve();

        var payments = resolved.get(0);
        assertThat(payments.groupId()).isEqualTo("payment-service");
        assertThat(payments.autoOffsetReset()).isEqualTo("earliest");
        assertThat(payments.maxRetryAttempts()).isEqualTo(7);
        assertThat(payments.readinessTimeout()).isZero();
        assertThat(payments.failOnTopicError()).isTrue();
        assertThat(payments.dlqTopic()).isEqualTo("payments-dead");

        var refunds = resolved.get(1);
        assertThat(refunds.maxRetryAttempts()).isEqualTo(5);
        assertThat(refunds.enableDlq()).isFalse();
        assertThat(refunds.dlqTopic()).isNull();
    }

    @Test
    void duplicate_names_are_rejected() {
        consumer("orders", "orders", c -> { });
        consumer("orders", "orders-v2", c -> { });

        assertThatThrownBy(props::resolve)
                .isInstanceOf(ConsumerConfigException.class)
                .hasMessage("consumer[1] (orders): duplicate consumer name");
    }

    @Test
    void dlq_topic_must_differ_from_topic() {
        consumer("orders", "orders", c -> c.setDlqTopic("orders"));

        assertThatThrownBy(props::resolve).hasMessageContaining("dlq-topic must differ from topic");
    }

    @Test
    void group_id_is_required() {
        props.getDefaults().setGroupId(null);
        consumer("orders", "orders", c -> { });

        assertThatThrownBy(props::resolve).hasMessageContaining("group-id is required");
    }

    @Test
    void name_and_topic_are_required() {
        consumer(null, "orders", c -> { });
        assertThatThrownBy(props::resolve).hasMessage("consumer[0]: name is required");

        props.getConsumers().clear();
        consumer("orders", " ", c -> { });
        assertThatThrownBy(props::resolve).hasMessageContaining("topic is required");
    }

    @Test
    void bounds_are_enforced() {
        expectInvalid(c -> c.setMaxRetryAttempts(0), "max-retry-attempts");
        expectInvalid(c -> c.setMaxRetryAttempts(101), "max-retry-attempts");
        expectInvalid(c -> c.setInitialBackoff(Duration.ofMillis(50)), "initial-backoff");
        expectInvalid(c -> c.setMaxBackoff(Duration.ofMinutes(6)), "max-backoff");
        expectInvalid(c -> c.setProcessingTimeout(Duration.ofMinutes(11)), "processing-timeout");
        expectInvalid(c -> c.setChannelBufferSize(5), "channel-buffer-size");
        expectInvalid(c -> c.setReadinessTimeoutSeconds(601), "readiness-timeout-seconds");
        expectInvalid(c -> c.setCommitInterval(Duration.ofMillis(10)), "commit-interval");
        expectInvalid(c -> c.setAutoOffsetReset("none"), "auto-offset-reset");
    }

    @Test
    void initial_backoff_cannot_exceed_max_backoff() {
        expectInvalid(c -> {
            c.setInitialBackoff(Duration.ofSeconds(20));
            c.setMaxBackoff(Duration.ofSeconds(10));
        }, "cannot be greater than max-backoff");
    }

    private void expectInvalid(Consumer<KafkaPipelineProperties.ConsumerProperties> custom, String message) {
        props.getConsumers().clear();
        consumer("orders", "orders", custom);
        assertThatThrownBy(props::resolve)
                .isInstanceOf(ConsumerConfigException.class)
                .hasMessageStartingWith("consumer[0] (orders): ")
                .hasMessageContaining(message);
    }
}
