package org.waabox.chorus.schedule;

import java.time.Duration;
import java.time.Instant;

/**
 * The source of time and delayed execution for every Chorus component.
 *
 * <p>Periodic refresh timers, backoff waits, reconnect delays and the
 * delayed {@code forceRefresh} publication all go through this seam, so a
 * virtual-time implementation can drive them deterministically.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface TaskScheduler {

  /**
   * Runs the task once after the given delay.
   *
   * @param task  the task to run, never null
   * @param delay the delay, never null
   * @return a handle to cancel the task, never null
   */
  ScheduledTask schedule(Runnable task, Duration delay);

  /**
   * Runs the task repeatedly, first after {@code initialDelay} and then
   * every {@code period}.
   *
   * <p>A task that throws is logged and keeps its schedule.
   *
   * @param task         the task to run, never null
   * @param initialDelay the delay before the first run, never null
   * @param period       the period between runs, never null and positive
   * @return a handle to cancel the task, never null
   */
  ScheduledTask scheduleAtFixedRate(Runnable task, Duration initialDelay,
      Duration period);

  /**
   * Returns the current instant as seen by this scheduler.
   *
   * @return the current instant, never null
   */
  Instant now();

  /**
   * Stops running tasks and releases the scheduler threads, if any.
   */
  void shutdown();
}
