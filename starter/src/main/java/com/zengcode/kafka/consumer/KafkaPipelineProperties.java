package com.zengcode.kafka.consumer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

/**
 * {@code kafka.pipeline.*}: a block of defaults and one entry per consumer. Any setting left out
 * of a consumer entry is taken from {@code defaults}.
 */
@ConfigurationProperties("kafka.pipeline")
public class KafkaPipelineProperties {

  static final int MAX_READINESS_TIMEOUT_SECONDS = 600;

  private boolean enabled = true;
  /** Start consumers with the application context. */
  private boolean autoStartup = true;
  private Defaults defaults = new Defaults();
  private List<ConsumerProperties> consumers = new ArrayList<>();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public boolean isAutoStartup() {
    return autoStartup;
  }

  public void setAutoStartup(boolean autoStartup) {
    this.autoStartup = autoStartup;
  }

  public Defaults getDefaults() {
    return defaults;
  }

  public void setDefaults(Defaults defaults) {
    this.defaults = defaults;
  }

  public List<ConsumerProperties> getConsumers() {
    return consumers;
  }

  public void setConsumers(List<ConsumerProperties> consumers) {
    this.consumers = consumers;
  }

  /**
   * Applies the defaults to every consumer entry and validates the result.
   *
   * @throws ConsumerConfigException naming the first offending consumer and setting
   */
  public List<ConsumerSettings> resolve() {
    var names = new HashSet<String>();
    var resolved = new ArrayList<ConsumerSettings>();
    for (int i = 0; i < consumers.size(); i++) {
      var c = consumers.get(i);
      var where = "consumer[" + i + "] (" + c.getName() + ")";

      check(StringUtils.hasText(c.getName()), "consumer[" + i + "]: name is required");
      check(names.add(c.getName()), where + ": duplicate consumer name");
      check(StringUtils.hasText(c.getTopic()), where + ": topic is required");

      var groupId = or(c.getGroupId(), defaults.getGroupId());
      check(StringUtils.hasText(groupId), where + ": group-id is required (set it on the consumer or in defaults)");

      var offsetReset = or(c.getAutoOffsetReset(), defaults.getAutoOffsetReset()).toLowerCase(Locale.ROOT);
      check(offsetReset.equals("earliest") || offsetReset.equals("latest"),
          where + ": auto-offset-reset must be earliest or latest, got " + offsetReset);

      var enableDlq = or(c.getEnableDlq(), Boolean.TRUE);
      String dlqTopic = null;
      if (enableDlq) {
        dlqTopic = StringUtils.hasText(c.getDlqTopic()) ? c.getDlqTopic() : c.getTopic() + ".dlq";
        check(!dlqTopic.equals(c.getTopic()), where + ": dlq-topic must differ from topic " + c.getTopic());
      }

      int readinessSeconds = or(c.getReadinessTimeoutSeconds(), defaults.getReadinessTimeoutSeconds());
      check(readinessSeconds >= 0 && readinessSeconds <= MAX_READINESS_TIMEOUT_SECONDS,
          where + ": readiness-timeout-seconds must be between 0 and " + MAX_READINESS_TIMEOUT_SECONDS
              + ", got " + readinessSeconds);

      int maxRetryAttempts = or(c.getMaxRetryAttempts(), defaults.getMaxRetryAttempts());
      check(maxRetryAttempts >= 1 && maxRetryAttempts <= 100,
          where + ": max-retry-attempts must be between 1 and 100, got " + maxRetryAttempts);

      var initialBackoff = within(where, "initial-backoff", or(c.getInitialBackoff(), defaults.getInitialBackoff()),
          Duration.ofMillis(100), Duration.ofSeconds(30));
      var maxBackoff = within(where, "max-backoff", or(c.getMaxBackoff(), defaults.getMaxBackoff()),
          Duration.ofSeconds(1), Duration.ofMinutes(5));
      check(initialBackoff.compareTo(maxBackoff) <= 0,
          where + ": initial-backoff (" + initialBackoff + ") cannot be greater than max-backoff (" + maxBackoff + ")");
      var processingTimeout = within(where, "processing-timeout",
          or(c.getProcessingTimeout(), defaults.getProcessingTimeout()), Duration.ofMillis(100), Duration.ofMinutes(10));
      var commitInterval = within(where, "commit-interval", or(c.getCommitInterval(), defaults.getCommitInterval()),
          Duration.ofMillis(100), Duration.ofSeconds(60));

      int channelBufferSize = or(c.getChannelBufferSize(), defaults.getChannelBufferSize());
      check(channelBufferSize >= 10 && channelBufferSize <= 10_000,
          where + ": channel-buffer-size must be between 10 and 10000, got " + channelBufferSize);

      resolved.add(new ConsumerSettings(c.getName(), c.getTopic(), groupId, offsetReset, enableDlq, dlqTopic,
          Duration.ofSeconds(readinessSeconds), or(c.getFailOnTopicError(), defaults.getFailOnTopicError()),
          maxRetryAttempts, initialBackoff, maxBackoff, processingTimeout, channelBufferSize, commitInterval));
    }
    return resolved;
  }

  private static <V> V or(V value, V fallback) {
    return value != null ? value : fallback;
  }

  private static void check(boolean condition, String message) {
    if (!condition) {
      throw new ConsumerConfigException(message);
    }
  }

  private static Duration within(String where, String key, Duration value, Duration min, Duration max) {
    check(value.compareTo(min) >= 0 && value.compareTo(max) <= 0,
        where + ": " + key + " must be between " + min + " and " + max + ", got " + value);
    return value;
  }

  /** Values every consumer inherits unless it sets its own. */
  public static class Defaults {

    private String groupId;
    private String autoOffsetReset = "latest";
    private Integer maxRetryAttempts = 3;
    private Duration initialBackoff = Duration.ofSeconds(1);
    private Duration maxBackoff = Duration.ofSeconds(30);
    private Duration processingTimeout = Duration.ofSeconds(30);
    private Integer channelBufferSize = 100;
    /** 0 waits for the topic without limit. */
    private Integer readinessTimeoutSeconds = 60;
    private Boolean failOnTopicError = false;
    private Duration commitInterval = Duration.ofSeconds(3);

    public String getGroupId() {
      return groupId;
    }

    public void setGroupId(String groupId) {
      this.groupId = groupId;
    }

    public String getAutoOffsetReset() {
      return autoOffsetReset;
    }

    public void setAutoOffsetReset(String autoOffsetReset) {
      this.autoOffsetReset = autoOffsetReset;
    }

    public Integer getMaxRetryAttempts() {
      return maxRetryAttempts;
    }

    public void setMaxRetryAttempts(Integer maxRetryAttempts) {
      this.maxRetryAttempts = maxRetryAttempts;
    }

    public Duration getInitialBackoff() {
      return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
      this.initialBackoff = initialBackoff;
    }

    public Duration getMaxBackoff() {
      return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
      this.maxBackoff = maxBackoff;
    }

    public Duration getProcessingTimeout() {
      return processingTimeout;
    }

    public void setProcessingTimeout(Duration processingTimeout) {
      this.processingTimeout = processingTimeout;
    }

    public Integer getChannelBufferSize() {
      return channelBufferSize;
    }

    public void setChannelBufferSize(Integer channelBufferSize) {
      this.channelBufferSize = channelBufferSize;
    }

    public Integer getReadinessTimeoutSeconds() {
      return readinessTimeoutSeconds;
    }

    public void setReadinessTimeoutSeconds(Integer readinessTimeoutSeconds) {
      this.readinessTimeoutSeconds = readinessTimeoutSeconds;
    }

    public Boolean getFailOnTopicError() {
      return failOnTopicError;
    }

    public void setFailOnTopicError(Boolean failOnTopicError) {
      this.failOnTopicError = failOnTopicError;
    }

    public Duration getCommitInterval() {
      return commitInterval;
    }

    public void setCommitInterval(Duration commitInterval) {
      this.commitInterval = commitInterval;
    }
  }

  /** One {@code consumers[*]} entry. Unset fields inherit from {@link Defaults}. */
  public static class ConsumerProperties extends Defaults {

    private String name;
    private String topic;
    private Boolean enableDlq;
    private String dlqTopic;

    public ConsumerProperties() {
      setAutoOffsetReset(null);
      setMaxRetryAttempts(null);
      setInitialBackoff(null);
      setMaxBackoff(null);
      setProcessingTimeout(null);
      setChannelBufferSize(null);
      setReadinessTimeoutSeconds(null);
      setFailOnTopicError(null);
      setCommitInterval(null);
    }

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public String getTopic() {
      return topic;
    }

    public void setTopic(String topic) {
      this.topic = topic;
    }

    public Boolean getEnableDlq() {
      return enableDlq;
    }

    public void setEnableDlq(Boolean enableDlq) {
      this.enableDlq = enableDlq;
    }

    public String getDlqTopic() {
      return dlqTopic;
    }

    public void setDlqTopic(String dlqTopic) {
      this.dlqTopic = dlqTopic;
    }
  }
}
