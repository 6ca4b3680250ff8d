package org.waabox.chorus.health;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.chorus.schedule.ScheduledTask;
import org.waabox.chorus.schedule.TaskScheduler;

/**
 * Periodically runs a {@link HealthProbe} and records the result in a
 * {@link MutableHealthGate}.
 *
 * <p>The first check runs as soon as the monitor starts. A probe that
 * throws counts as unhealthy. Transitions are logged: losing the backend
 * at WARN, recovering at INFO.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HealthMonitor {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(HealthMonitor.class);

  /** The probe to run, never null. */
  private final HealthProbe probe;

  /** The gate to update, never null. */
  private final MutableHealthGate gate;

  /** The scheduler running the checks, never null. */
  private final TaskScheduler scheduler;

  /** The interval between checks, never null. */
  private final Duration interval;

  /** Whether the monitor is running. */
  private final AtomicBoolean running = new AtomicBoolean(false);

  /** The periodic check, null while stopped. */
  private volatile ScheduledTask task;

  /**
   * Creates a new monitor.
   *
   * @param theProbe     the probe, never null
   * @param theGate      the gate to update, never null
   * @param theScheduler the scheduler, never null
   * @param theInterval  the interval between checks, positive
   */
  public HealthMonitor(final HealthProbe theProbe,
      final MutableHealthGate theGate, final TaskScheduler theScheduler,
      final Duration theInterval) {
    probe = Objects.requireNonNull(theProbe, "probe must not be null");
    gate = Objects.requireNonNull(theGate, "gate must not be null");
    scheduler = Objects.requireNonNull(theScheduler,
        "scheduler must not be null");
    interval = Objects.requireNonNull(theInterval,
        "interval must not be null");
    if (theInterval.isZero() || theInterval.isNegative()) {
      throw new IllegalArgumentException(
          "interval must be positive, got: " + theInterval);
    }
  }

  /** Starts the periodic checks. Has no effect if already running. */
  public void start() {
    if (!running.compareAndSet(false, true)) {
      log.debug("HealthMonitor already running");
      return;
    }
    task = scheduler.scheduleAtFixedRate(this::checkNow, Duration.ZERO,
        interval);
    log.info("HealthMonitor started, probing every {} ms",
        interval.toMillis());
  }

  /** Stops the periodic checks. Has no effect if not running. */
  public void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    final ScheduledTask current = task;
    if (current != null) {
      current.cancel();
    }
    task = null;
    log.info("HealthMonitor stopped");
  }

  /**
   * Runs the probe once and records the result.
   *
   * @return the recorded health state
   */
  public boolean checkNow() {
    boolean healthy;
    try {
      healthy = probe.probe();
    } catch (final Exception e) {
      log.debug("Health probe threw: {}", e.getMessage(), e);
      healthy = false;
    }

    final boolean previous = gate.update(healthy);
    if (previous && !healthy) {
      log.warn("Backend became unreachable, periodic refreshes are paused");
    } else if (!previous && healthy) {
      log.info("Backend reachable again, periodic refreshes resume");
    }
    return healthy;
  }

  /**
   * Tells whether the monitor is running.
   *
   * @return true between {@link #start()} and {@link #stop()}
   */
  public boolean isRunning() {
    return running.get();
  }
}
