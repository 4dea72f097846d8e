package com.zengcode.kafka.consumer;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.availability.AvailabilityChangeEvent;
import org.springframework.boot.availability.ReadinessState;
import org.springframework.context.ApplicationListener;

/**
 * Opens once the application reports {@link ReadinessState#ACCEPTING_TRAFFIC}, so consumers only
 * start polling after every runner has finished. Once open it stays open.
 */
public class TrafficReadinessGate implements ReadinessWaiter, ApplicationListener<AvailabilityChangeEvent<ReadinessState>> {

  private static final Logger log = LoggerFactory.getLogger(TrafficReadinessGate.class);

  private static final Duration CHECK_SLICE = Duration.ofMillis(100);

  private final CountDownLatch ready = new CountDownLatch(1);

  @Override
  public void onApplicationEvent(AvailabilityChangeEvent<ReadinessState> event) {
    if (event.getState() == ReadinessState.ACCEPTING_TRAFFIC) {
      markTrafficReady();
    }
  }

  /** Opens the gate without waiting for the availability event. */
  public void markTrafficReady() {
    if (ready.getCount() > 0) {
      log.info("service is ready for traffic, releasing kafka consumers");
      ready.countDown();
    }
  }

  public boolean isTrafficReady() {
    return ready.getCount() == 0;
  }

  @Override
  public boolean awaitTrafficReady(CancellationToken token) {
    while (!token.isCancelled()) {
      try {
        if (ready.await(CHECK_SLICE.toMillis(), TimeUnit.MILLISECONDS)) {
          return true;
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return false;
      }
    }
    return false;
  }
}
