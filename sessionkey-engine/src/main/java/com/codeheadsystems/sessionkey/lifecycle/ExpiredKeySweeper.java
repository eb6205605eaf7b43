package com.codeheadsystems.sessionkey.lifecycle;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically expires session keys whose expiration time has passed.
 * <p>
 * Expiry is also applied lazily on access, so the sweep only keeps listings and stored state
 * current between uses.
 */
public class ExpiredKeySweeper {

  /**
   * Default sweep interval.
   */
  public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(5);

  private static final Logger log = LoggerFactory.getLogger(ExpiredKeySweeper.class);

  private final LifecycleController lifecycleController;
  private final Duration interval;
  private ScheduledExecutorService scheduler;

  /**
   * Instantiates a new Expired key sweeper.
   *
   * @param lifecycleController the lifecycle controller
   * @param interval            time between sweeps
   */
  public ExpiredKeySweeper(LifecycleController lifecycleController, Duration interval) {
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    this.lifecycleController = lifecycleController;
    this.interval = interval;
  }

  /**
   * Starts sweeping. Calling start twice is an error.
   */
  public synchronized void start() {
    if (scheduler != null) {
      throw new IllegalStateException("Sweeper already started");
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "session-key-sweeper");
      t.setDaemon(true);
      return t;
    });
    long millis = interval.toMillis();
    scheduler.scheduleAtFixedRate(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
    log.info("Session key sweeper started, interval {}", interval);
  }

  /**
   * Runs one sweep now.
   *
   * @return the number of keys expired
   */
  public int sweep() {
    try {
      return lifecycleController.cleanupExpired();
    } catch (RuntimeException e) {
      // Keep the schedule alive; a thrown exception would cancel future runs.
      log.error("Session key sweep failed", e);
      return 0;
    }
  }

  /**
   * Stops sweeping and waits briefly for a running sweep to finish.
   */
  public synchronized void shutdown() {
    if (scheduler == null) {
      return;
    }
    scheduler.shutdown();
    try {
      if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
        scheduler.shutdownNow();
      }
    } catch (InterruptedException e) {
      scheduler.shutdownNow();
      Thread.currentThread().interrupt();
    }
    scheduler = null;
    log.info("Session key sweeper stopped");
  }

  /**
   * Is running.
   *
   * @return the boolean
   */
  public synchronized boolean isRunning() {
    return scheduler != null;
  }
}
