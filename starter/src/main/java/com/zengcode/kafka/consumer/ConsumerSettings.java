package com.zengcode.kafka.consumer;

import java.time.Duration;

/**
 * Fully resolved and validated settings of one consumer. Built by
 * {@link KafkaPipelineProperties#resolve()}.
 *
 * @param readinessTimeout how long to wait for topic metadata, zero for no limit
 * @param dlqTopic null when {@code enableDlq} is false
 */
public record ConsumerSettings(
    String name,
    String topic,
    String groupId,
    String autoOffsetReset,
    boolean enableDlq,
    String dlqTopic,
    Duration readinessTimeout,
    boolean failOnTopicError,
    int maxRetryAttempts,
    Duration initialBackoff,
    Duration maxBackoff,
    Duration processingTimeout,
    int channelBufferSize,
    Duration commitInterval) {

  /** Settings with every tunable at its default and the dead-letter topic enabled. */
  public static ConsumerSettings defaults(String name, String topic, String groupId) {
    var d = new KafkaPipelineProperties.Defaults();
    return new ConsumerSettings(name, topic, groupId, d.getAutoOffsetReset(), true, topic + ".dlq",
        Duration.ofSeconds(d.getReadinessTimeoutSeconds()), d.getFailOnTopicError(), d.getMaxRetryAttempts(),
        d.getInitialBackoff(), d.getMaxBackoff(), d.getProcessingTimeout(), d.getChannelBufferSize(),
        d.getCommitInterval());
  }

  public ConsumerSettings withRetry(int maxRetryAttempts, Duration initialBackoff, Duration maxBackoff) {
    return new ConsumerSettings(name, topic, groupId, autoOffsetReset, enableDlq, dlqTopic, readinessTimeout,
        failOnTopicError, maxRetryAttempts, initialBackoff, maxBackoff, processingTimeout, channelBufferSize,
        commitInterval);
  }

  public ConsumerSettings withProcessingTimeout(Duration processingTimeout) {
    return new ConsumerSettings(name, topic, groupId, autoOffsetReset, enableDlq, dlqTopic, readinessTimeout,
        failOnTopicError, maxRetryAttempts, initialBackoff, maxBackoff, processingTimeout, channelBufferSize,
        commitInterval);
  }

  public ConsumerSettings withReadiness(Duration readinessTimeout, boolean failOnTopicError) {
    return new ConsumerSettings(name, topic, groupId, autoOffsetReset, enableDlq, dlqTopic, readinessTimeout,
        failOnTopicError, maxRetryAttempts, initialBackoff, maxBackoff, processingTimeout, channelBufferSize,
        commitInterval);
  }

  public ConsumerSettings withoutDlq() {
    return new ConsumerSettings(name, topic, groupId, autoOffsetReset, false, null, readinessTimeout,
        failOnTopicError, maxRetryAttempts, initialBackoff, maxBackoff, processingTimeout, channelBufferSize,
        commitInterval);
  }
}
