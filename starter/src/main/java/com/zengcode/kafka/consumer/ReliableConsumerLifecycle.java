package com.zengcode.kafka.consumer;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.context.SmartLifecycle;
import org.springframework.kafka.core.KafkaTemplate;

/**
 * Starts every configured consumer with the application context and stops them, in reverse order,
 * when it closes. A consumer that fails to start fails the context.
 */
public class ReliableConsumerLifecycle implements SmartLifecycle, DisposableBean {

  private static final Logger log = LoggerFactory.getLogger(ReliableConsumerLifecycle.class);

  static final int PHASE = Integer.MAX_VALUE - 100;

  private final List<ReliableKafkaConsumer<?>> consumers;
  private final KafkaTemplate<byte[], byte[]> dlqTemplate;
  private final boolean autoStartup;
  private volatile boolean running;

  public ReliableConsumerLifecycle(List<ReliableKafkaConsumer<?>> consumers, KafkaTemplate<byte[], byte[]> dlqTemplate,
                                   boolean autoStartup) {
    this.consumers = List.copyOf(consumers);
    this.dlqTemplate = dlqTemplate;
    this.autoStartup = autoStartup;
  }

  @Override
  public void start() {
    var started = new ArrayList<ReliableKafkaConsumer<?>>();
    for (var consumer : consumers) {
      try {
        consumer.start();
        started.add(consumer);
      } catch (RuntimeException e) {
        log.error("failed to start consumer {}, stopping the {} already started", consumer.getName(),
            started.size(), e);
        stopAll(started);
        throw e;
      }
    }
    running = true;
    log.info("started {} kafka consumer(s)", consumers.size());
  }

  @Override
  public void stop() {
    stopAll(consumers);
    running = false;
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public boolean isAutoStartup() {
    return autoStartup;
  }

  @Override
  public int getPhase() {
    return PHASE;
  }

  /** Also releases consumers that were never started. */
  @Override
  public void destroy() {
    stopAll(consumers);
    if (dlqTemplate != null) {
      dlqTemplate.destroy();
    }
  }

  public List<ReliableKafkaConsumer<?>> getConsumers() {
    return consumers;
  }

  private static void stopAll(List<ReliableKafkaConsumer<?>> consumers) {
    for (int i = consumers.size() - 1; i >= 0; i--) {
      var consumer = consumers.get(i);
      try {
        consumer.stop();
      } catch (RuntimeException e) {
        log.error("failed to stop consumer {}", consumer.getName(), e);
      }
    }
  }
}
