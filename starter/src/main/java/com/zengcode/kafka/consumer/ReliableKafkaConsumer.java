package com.zengcode.kafka.consumer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * One reliable consumer: a reader thread polling the broker, a processor thread running the
 * handler with retries, and the bounded channel between them.
 *
 * <p>Every consumed record ends up either stored for commit or on the dead-letter topic (and then
 * stored too). Offsets are committed periodically by the reader and once more on {@link #stop()}.
 */
public class ReliableKafkaConsumer<T> {

  private static final Logger log = LoggerFactory.getLogger(ReliableKafkaConsumer.class);

  private static final Duration SLOW_STOP_WARNING = Duration.ofSeconds(30);

  private final ConsumerSettings settings;
  private final Consumer<byte[], byte[]> client;
  private final CancellationToken token = new CancellationToken();
  private final OffsetStore offsetStore = new OffsetStore();
  private final ExecutorService handlerPool;
  private final Initializer initializer;
  private final Thread readerThread;
  private final Thread processorThread;
  private final AtomicReference<ConsumerState> state = new AtomicReference<>(ConsumerState.NOT_STARTED);
  private final Object lifecycleLock = new Object();

  public ReliableKafkaConsumer(ConsumerSettings settings, Consumer<byte[], byte[]> client,
                               ConsumerDefinition<T> definition, DlqHandler dlqHandler, MessageTracer tracer,
                               ReadinessWaiter readiness) {
    this(settings, client, definition, dlqHandler, tracer, readiness, Reader.POLL_TIMEOUT, Initializer.RETRY_INTERVAL);
  }

  ReliableKafkaConsumer(ConsumerSettings settings, Consumer<byte[], byte[]> client, ConsumerDefinition<T> definition,
                        DlqHandler dlqHandler, MessageTracer tracer, ReadinessWaiter readiness,
                        Duration pollTimeout, Duration topicRetryInterval) {
    this.settings = settings;
    this.client = client;

    var threadPrefix = "kafka-consumer-" + settings.name();
    var handlerThreads = new CustomizableThreadFactory(threadPrefix + "-handler-");
    handlerThreads.setDaemon(true);
    this.handlerPool = Executors.newCachedThreadPool(handlerThreads);

    var mdc = Map.of("consumer", settings.name(), "topic", settings.topic(), "groupId", settings.groupId());
    BlockingQueue<ConsumerRecord<byte[], byte[]>> channel = new ArrayBlockingQueue<>(settings.channelBufferSize());

    this.initializer = new Initializer(client, settings.topic(), settings.readinessTimeout(),
        settings.failOnTopicError(), new Initializer.CommittingRebalanceListener(client, offsetStore),
        topicRetryInterval);

    var reader = new Reader(client, channel, token, readiness, offsetStore, pollTimeout,
        settings.commitInterval(), mdc);
    var retryExecutor = new RetryExecutor(settings.maxRetryAttempts(), settings.initialBackoff(),
        settings.maxBackoff(), settings.processingTimeout(), handlerPool);
    var processor = new Processor<>(channel, token, tracer, retryExecutor,
        new ResultHandler(dlqHandler, offsetStore), definition.getDeserializer(), definition.getHandler(), mdc);

    this.readerThread = new Thread(reader, threadPrefix + "-reader");
    this.processorThread = new Thread(processor, threadPrefix + "-processor");
  }

  /**
   * Subscribes, waits for the topic and starts both worker threads. Calling it again is a no-op.
   *
   * @throws ConsumerStartupException if the topic never became ready; the client is closed. A
   *     {@link #stop()} while waiting is not a failure: the client is closed and this returns.
   */
  public void start() {
    if (!state.compareAndSet(ConsumerState.NOT_STARTED, ConsumerState.STARTING)) {
      log.debug("consumer {} already started", settings.name());
      return;
    }
    log.info("starting consumer: name={}, topic={}, groupId={}", settings.name(), settings.topic(),
        settings.groupId());

    RuntimeException failure = null;
    try {
      initializer.initialize(token);
    } catch (RuntimeException e) {
      failure = e;
    }

    synchronized (lifecycleLock) {
      if (token.isCancelled()) {
        log.info("consumer {} was stopped while starting", settings.name());
        release();
        return;
      }
      if (failure != null) {
        release();
        throw new ConsumerStartupException("failed to start consumer " + settings.name(), failure);
      }
      readerThread.start();
      processorThread.start();
      state.set(ConsumerState.RUNNING);
    }
    log.info("consumer {} started", settings.name());
  }

  /**
   * Stops both workers, commits everything processed so far and closes the client. Safe to call
   * more than once and before {@link #start()}. While {@link #start()} is still waiting for the
   * topic this only requests cancellation and the starting thread does the cleanup.
   */
  public void stop() {
    synchronized (lifecycleLock) {
      switch (state.get()) {
        case STARTING:
          token.cancel();
          client.wakeup();
          return;
        case NOT_STARTED:
          release();
          return;
        case RUNNING:
          state.set(ConsumerState.STOPPING);
          break;
        default:
          return;
      }
    }

    log.info("stopping consumer {}", settings.name());
    token.cancel();
    client.wakeup();
    join(readerThread);
    join(processorThread);

    commitFinal();
    release();
    log.info("consumer {} stopped", settings.name());
  }

  public ConsumerState state() {
    return state.get();
  }

  /** False once a fatal broker error has stopped the workers, even before {@link #stop()} is called. */
  public boolean isRunning() {
    return state.get() == ConsumerState.RUNNING && !token.isCancelled();
  }

  public String getName() {
    return settings.name();
  }

  private void commitFinal() {
    OffsetStore.CommitResult result;
    try {
      result = offsetStore.commitSync(client);
    } catch (WakeupException e) {
      // left over from the wakeup that interrupted the last poll
      result = offsetStore.commitSync(client);
    }
    switch (result) {
      case COMMITTED:
        log.info("committed final offsets for consumer {}", settings.name());
        break;
      case NOTHING_TO_COMMIT:
        log.debug("no offsets to commit for consumer {}", settings.name());
        break;
      default:
        log.warn("failed to commit final offsets for consumer {}, messages may be redelivered", settings.name());
        break;
    }
  }

  /** Waits for the worker to finish; the client is only closed once nothing else can touch it. */
  private void join(Thread worker) {
    var interrupted = false;
    var warned = false;
    while (worker.isAlive()) {
      try {
        worker.join(SLOW_STOP_WARNING.toMillis());
      } catch (InterruptedException e) {
        interrupted = true;
        continue;
      }
      if (worker.isAlive() && !warned) {
        log.warn("still waiting for {} to stop after {}", worker.getName(), SLOW_STOP_WARNING);
        warned = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  private void release() {
    token.cancel();
    closeClient();
    handlerPool.shutdownNow();
    state.set(ConsumerState.STOPPED);
  }

  private void closeClient() {
    try {
      client.close();
    } catch (KafkaException e) {
      log.warn("failed to close kafka client for consumer {}", settings.name(), e);
    }
  }

  OffsetStore offsetStore() {
    return offsetStore;
  }

  ExecutorService handlerPool() {
    return handlerPool;
  }
}
