package com.zengcode.kafka.consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RetryExecutorTest {

    private final ExecutorService pool = Executors.newCachedThreadPool();
    private final CancellationToken token = new CancellationToken();
    private final AtomicInteger calls = new AtomicInteger();

    @AfterEach
    void shutdown() {
        pool.shutdownNow();
    }

    private RetryExecutor executor(int maxAttempts, Duration timeout) {
        return new RetryExecutor(maxAttempts, Duration.ofMillis(10), Duration.ofMillis(40), timeout, pool);
    }

    @Test
    void success_on_first_attempt() {
        var outcome = executor(3, Duration.ofSeconds(5)).execute(token, calls::incrementAndGet);

        assertThat(outcome.kind()).isEqualTo(ProcessingOutcome.Kind.SUCCESS);
        assertThat(calls).hasValue(1);
    }

    @Test
    void transient_failures_are_retried_until_success() {
        var outcome = executor(3, Duration.ofSeconds(5)).execute(token, () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("database busy");
            }
        });

        assertThat(outcome.kind()).isEqualTo(ProcessingOutcome.Kind.SUCCESS);
        assertThat(calls).hasValue(3);
    }

    @Test
    void exhausted_after_max_attempts() {
        var outcome = executor(3, Duration.ofSeconds(5)).execute(token, () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("database down");
        });

        assertThat(outcome.kind()).isEqualTo(ProcessingOutcome.Kind.EXHAUSTED);
        assertThat(outcome.cause())
                .isInstanceOf(RetriesExhaustedException.class)
                .hasMessageContaining("max retry attempts reached (3)")
                .hasRootCauseMessage("database down");
        assertThat(calls).hasValue(3);
    }

    @Test
    void skip_short_circuits() {
        var outcome = executor(5, Duration.ofSeconds(5)).execute(token, () -> {
            calls.incrementAndGet();
            throw new SkipMessageException("duplicate");
        });

        assertThat(outcome.kind()).isEqualTo(ProcessingOutcome.Kind.SKIPPED);
        assertThat(outcome.isFailure()).isFalse();
        assertThat(calls).hasValue(1);
    }

    @Test
    void permanent_short_circuits() {
        var outcome = executor(5, Duration.ofSeconds(5)).execute(token, () -> {
            calls.incrementAndGet();
            throw new PermanentProcessingException("invalid payload");
        });

        assertThat(outcome.kind()).isEqualTo(ProcessingOutcome.Kind.PERMANENT);
        assertThat(outcome.cause()).hasMessage("invalid payload");
        assertThat(calls).hasValue(1);
    }

    @Test
    void errors_become_permanent_panics_and_are_not_retried() {
        var outcome = executor(5, Duration.ofSeconds(5)).execute(token, () -> {
            calls.incrementAndGet();
            throw new LinkageError("handler bug");
        });

        assertThat(outcome.kind()).isEqualTo(ProcessingOutcome.Kind.PERMANENT);
        assertThat(outcome.cause()).isInstanceOf(PanicException.class);
        var panic = (PanicException) outcome.cause();
        assertThat(panic.getPanic()).isInstanceOf(LinkageError.class).hasMessage("handler bug");
        assertThat(panic.getStack()).contains("LinkageError", "RetryExecutorTest");
        assertThat(calls).hasValue(1);
    }

    @Test
    void attempt_exceeding_timeout_is_interrupted_and_counts_as_transient() {
        var interrupted = new CountDownLatch(2);
        var outcome = executor(2, Duration.ofMillis(100)).execute(token, () -> {
            calls.incrementAndGet();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
        });

        assertThat(outcome.kind()).isEqualTo(ProcessingOutcome.Kind.EXHAUSTED);
        assertThat(outcome.cause().getCause()).isInstanceOf(ProcessingTimeoutException.class);
        assertThat(calls).hasValue(2);
        assertThat(awaitQuietly(interrupted)).isTrue();
    }

    @Test
    void attempt_ignoring_interrupt_never_overlaps_with_its_retry() {
        var active = new AtomicInteger();
        var maxActive = new AtomicInteger();
        var outcome = new RetryExecutor(3, Duration.ofMillis(10), Duration.ofMillis(10), Duration.ofMillis(100), pool)
                .execute(token, () -> {
                    maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                    try {
                        busyWait(Duration.ofMillis(500));
                    } finally {
                        active.decrementAndGet();
                    }
                });

        assertThat(outcome.kind()).isEqualTo(ProcessingOutcome.Kind.EXHAUSTED);
        assertThat(outcome.cause().getCause()).isInstanceOf(ProcessingTimeoutException.class);
        assertThat(maxActive).hasValue(1);
        assertThat(active).hasValue(0);
    }

    @Test
    void cancellation_aborts_backoff_wait() {
        var executor = new RetryExecutor(5, Duration.ofSeconds(10), Duration.ofSeconds(30), Duration.ofSeconds(5), pool);
        pool.submit(() -> {
            Thread.sleep(200);
            token.cancel();
            return null;
        });

        var started = System.nanoTime();
        var outcome = executor.execute(token, () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("still failing");
        });

        assertThat(outcome.kind()).isEqualTo(ProcessingOutcome.Kind.EXHAUSTED);
        assertThat(outcome.cause()).isInstanceOf(ProcessingCancelledException.class);
        assertThat(calls).hasValue(1);
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    void cancellation_interrupts_in_flight_attempt() {
        pool.submit(() -> {
            Thread.sleep(200);
            token.cancel();
            return null;
        });

        var outcome = executor(3, Duration.ofSeconds(30)).execute(token, () -> {
            calls.incrementAndGet();
            Thread.sleep(20_000);
        });

        assertThat(outcome.kind()).isEqualTo(ProcessingOutcome.Kind.EXHAUSTED);
        assertThat(outcome.cause()).isInstanceOf(ProcessingCancelledException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void no_attempt_once_cancelled() {
        token.cancel();

        var outcome = executor(3, Duration.ofSeconds(5)).execute(token, calls::incrementAndGet);

        assertThat(outcome.kind()).isEqualTo(ProcessingOutcome.Kind.EXHAUSTED);
        assertThat(calls).hasValue(0);
    }

    @Test
    void backoff_doubles_and_is_capped() {
        var initial = Duration.ofSeconds(1);
        var max = Duration.ofSeconds(30);

        assertThat(RetryExecutor.backoff(1, initial, max)).isEqualTo(Duration.ofSeconds(1));
        assertThat(RetryExecutor.backoff(2, initial, max)).isEqualTo(Duration.ofSeconds(2));
        assertThat(RetryExecutor.backoff(3, initial, max)).isEqualTo(Duration.ofSeconds(4));
        assertThat(RetryExecutor.backoff(5, initial, max)).isEqualTo(Duration.ofSeconds(16));
        assertThat(RetryExecutor.backoff(6, initial, max)).isEqualTo(max);
        assertThat(RetryExecutor.backoff(100, initial, max)).isEqualTo(max);

        var previous = Duration.ZERO;
        for (int attempt = 1; attempt <= 100; attempt++) {
            var delay = RetryExecutor.backoff(attempt, Duration.ofMillis(100), Duration.ofMinutes(5));
            assertThat(delay).isGreaterThanOrEqualTo(previous).isLessThanOrEqualTo(Duration.ofMinutes(5));
            previous = delay;
        }
    }

    @Test
    void initial_backoff_above_max_is_rejected() {
        assertThatThrownBy(() -> new RetryExecutor(3, Duration.ofSeconds(10), Duration.ofSeconds(1),
                Duration.ofSeconds(1), pool))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cannot be greater than max backoff");
    }

    private static void busyWait(Duration duration) {
        var until = System.nanoTime() + duration.toNanos();
        while (System.nanoTime() < until) {
            Thread.onSpinWait();
        }
    }

    private static boolean awaitQuietly(CountDownLatch latch) {
        try {
            return latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
