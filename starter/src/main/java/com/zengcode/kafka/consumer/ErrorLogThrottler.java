package com.zengcode.kafka.consumer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Logs temporary broker errors with decaying verbosity: WARN at most once per interval for each
 * tracking key, DEBUG otherwise. Counters reset once a poll succeeds again.
 */
final class ErrorLogThrottler {

  static final Duration DEFAULT_WARN_INTERVAL = Duration.ofMinutes(5);

  private final Logger log;
  private final Clock clock;
  private final Duration warnInterval;
  private final Map<String, Counter> counters = new HashMap<>();

  ErrorLogThrottler(Logger log) {
    this(log, Clock.systemUTC(), DEFAULT_WARN_INTERVAL);
  }

  ErrorLogThrottler(Logger log, Clock clock, Duration warnInterval) {
    this.log = log;
    this.clock = clock;
    this.warnInterval = warnInterval;
  }

  /** @return true when the error was logged at WARN */
  synchronized boolean log(ClassifiedError error) {
    var now = clock.instant();
    var counter = counters.computeIfAbsent(error.trackingKey(), k -> new Counter(now));
    counter.count++;

    var shouldWarn = counter.lastWarn == null
        || Duration.between(counter.lastWarn, now).compareTo(warnInterval) > 0;
    if (shouldWarn) {
      log.warn("{} (attempts={}, duration={})", error.description(), counter.count,
          Duration.between(counter.firstSeen, now), error.error());
      counter.lastWarn = now;
    } else if (log.isDebugEnabled()) {
      log.debug("{}: {}", error.description(), error.error().toString());
    }
    return shouldWarn;
  }

  synchronized void reset() {
    counters.clear();
  }

  synchronized int attempts(String trackingKey) {
    var counter = counters.get(trackingKey);
    return counter == null ? 0 : counter.count;
  }

  private static final class Counter {
    private final Instant firstSeen;
    private Instant lastWarn;
    private int count;

    private Counter(Instant firstSeen) {
      this.firstSeen = firstSeen;
    }
  }
}
