package com.codeheadsystems.provision.server.manager;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls for due scheduled rotations on a single daemon thread.
 */
public class RotationScheduler {

  private static final Logger log = LoggerFactory.getLogger(RotationScheduler.class);

  private final KeyRotationManager rotationManager;
  private final Duration pollInterval;
  private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
    Thread t = new Thread(r, "rotation-scheduler");
    t.setDaemon(true);
    return t;
  });

  public RotationScheduler(KeyRotationManager rotationManager, Duration pollInterval) {
    this.rotationManager = rotationManager;
    this.pollInterval = pollInterval;
  }

  public void start() {
    log.info("Starting rotation scheduler, polling every {}", pollInterval);
    executor.scheduleWithFixedDelay(this::poll, pollInterval.toMillis(), pollInterval.toMillis(),
        TimeUnit.MILLISECONDS);
  }

  /**
   * Stops polling. A run in progress is interrupted.
   */
  public void shutdown() {
    executor.shutdownNow();
  }

  void poll() {
    try {
      int processed = rotationManager.runDueRotations();
      if (processed > 0) {
        log.info("Processed {} scheduled rotation(s)", processed);
      }
    } catch (RuntimeException e) {
      // A thrown exception would cancel every later run.
      log.error("Scheduled rotation run failed", e);
    }
  }
}
