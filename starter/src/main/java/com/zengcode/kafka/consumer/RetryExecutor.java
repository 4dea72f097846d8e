package com.zengcode.kafka.consumer;

import io.opentelemetry.context.Context;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs user code for one message with bounded attempts, exponential backoff and a per-attempt
 * timeout, and folds every way it can end into a single {@link ProcessingOutcome}.
 *
 * <p>This is the only place where failures escaping user code are caught. Attempts run on
 * {@code attemptPool} so that a timed out or cancelled attempt can be interrupted; the next attempt
 * starts only after the interrupted one has returned.
 */
final class RetryExecutor {

  private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

  private static final long WAIT_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

  @FunctionalInterface
  interface Attempt {
    void run() throws Exception;
  }

  private final int maxAttempts;
  private final Duration initialBackoff;
  private final Duration maxBackoff;
  private final Duration processingTimeout;
  private final ExecutorService attemptPool;

  RetryExecutor(int maxAttempts, Duration initialBackoff, Duration maxBackoff, Duration processingTimeout,
                ExecutorService attemptPool) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1, got: " + maxAttempts);
    }
    if (initialBackoff.compareTo(maxBackoff) > 0) {
      throw new IllegalArgumentException("initial backoff (" + initialBackoff
          + ") cannot be greater than max backoff (" + maxBackoff + ")");
    }
    this.maxAttempts = maxAttempts;
    this.initialBackoff = initialBackoff;
    this.maxBackoff = maxBackoff;
    this.processingTimeout = processingTimeout;
    this.attemptPool = attemptPool;
  }

  ProcessingOutcome execute(CancellationToken token, Attempt attempt) {
    Throwable lastFailure = null;
    for (int n = 1; n <= maxAttempts; n++) {
      if (token.isCancelled()) {
        return ProcessingOutcome.exhausted(cancelled(lastFailure));
      }

      var failure = invoke(token, attempt);
      if (failure == null) {
        return ProcessingOutcome.success();
      }
      if (failure instanceof SkipMessageException) {
        return ProcessingOutcome.skipped(failure);
      }
      if (failure instanceof PermanentProcessingException) {
        return ProcessingOutcome.permanent(failure);
      }
      if (failure instanceof ProcessingCancelledException) {
        return ProcessingOutcome.exhausted(failure);
      }

      lastFailure = failure;
      log.error("failed to process message (attempt={}, maxAttempts={})", n, maxAttempts, failure);

      if (n < maxAttempts && token.await(backoff(n))) {
        return ProcessingOutcome.exhausted(cancelled(lastFailure));
      }
    }
    return ProcessingOutcome.exhausted(new RetriesExhaustedException(maxAttempts, lastFailure));
  }

  /** Delay after attempt {@code attempt}: {@code min(initial * 2^(attempt-1), max)}. */
  Duration backoff(int attempt) {
    return backoff(attempt, initialBackoff, maxBackoff);
  }

  static Duration backoff(int attempt, Duration initial, Duration max) {
    var shift = Math.min(Math.max(attempt - 1, 0), 30);
    var delay = initial.multipliedBy(1L << shift);
    return delay.compareTo(max) > 0 ? max : delay;
  }

  /** @return null on success, otherwise the failure with panics already isolated */
  private Throwable invoke(CancellationToken token, Attempt attempt) {
    var task = new TrackedAttempt(attempt, MDC.getCopyOfContextMap());

    Future<Void> future;
    try {
      future = attemptPool.submit(Context.current().wrap(task));
    } catch (RejectedExecutionException e) {
      return new ProcessingCancelledException("handler pool is shut down");
    }

    var deadline = System.nanoTime() + processingTimeout.toNanos();
    while (true) {
      var remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        abandon(future, task);
        return new ProcessingTimeoutException(processingTimeout);
      }
      try {
        future.get(Math.min(remaining, WAIT_SLICE_NANOS), TimeUnit.NANOSECONDS);
        return null;
      } catch (TimeoutException e) {
        if (token.isCancelled()) {
          abandon(future, task);
          return new ProcessingCancelledException("processing cancelled by consumer shutdown");
        }
      } catch (ExecutionException e) {
        return isolate(e.getCause());
      } catch (CancellationException e) {
        task.awaitFinished(processingTimeout);
        return new ProcessingCancelledException("processing attempt cancelled");
      } catch (InterruptedException e) {
        abandon(future, task);
        Thread.currentThread().interrupt();
        return new ProcessingCancelledException("processor thread interrupted");
      }
    }
  }

  /**
   * Interrupts the attempt and blocks until it has really returned, so that user code for one
   * message never runs twice at the same time and never outlives its outcome.
   */
  private void abandon(Future<Void> future, TrackedAttempt task) {
    future.cancel(true);
    task.awaitFinished(processingTimeout);
  }

  private static Throwable isolate(Throwable failure) {
    if (failure instanceof Error) {
      log.error("recovered from panic while processing message", failure);
      return new PanicException(failure);
    }
    return failure;
  }

  private static ProcessingCancelledException cancelled(Throwable lastFailure) {
    var e = new ProcessingCancelledException("processing cancelled by consumer shutdown");
    if (lastFailure != null) {
      e.addSuppressed(lastFailure);
    }
    return e;
  }

  /** User code plus a latch released when it returns, whether or not its future was cancelled. */
  private static final class TrackedAttempt implements Callable<Void> {

    private static final int PENDING = 0;
    private static final int RUNNING = 1;
    private static final int DROPPED = 2;

    private final Attempt attempt;
    private final Map<String, String> mdc;
    private final AtomicInteger phase = new AtomicInteger(PENDING);
    private final CountDownLatch finished = new CountDownLatch(1);

    TrackedAttempt(Attempt attempt, Map<String, String> mdc) {
      this.attempt = attempt;
      this.mdc = mdc;
    }

    @Override
    public Void call() throws Exception {
      if (!phase.compareAndSet(PENDING, RUNNING)) {
        return null;
      }
      if (mdc != null) {
        MDC.setContextMap(mdc);
      }
      try {
        attempt.run();
        return null;
      } finally {
        MDC.clear();
        finished.countDown();
      }
    }

    void awaitFinished(Duration warnAfter) {
      if (phase.compareAndSet(PENDING, DROPPED)) {
        return;
      }
      var interrupted = false;
      var warned = false;
      while (true) {
        try {
          if (finished.await(warnAfter.toMillis(), TimeUnit.MILLISECONDS)) {
            break;
          }
        } catch (InterruptedException e) {
          interrupted = true;
          continue;
        }
        if (!warned) {
          log.warn("handler is ignoring interruption, still waiting for it to return after {}", warnAfter);
          warned = true;
        }
      }
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }
}
