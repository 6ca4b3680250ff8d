package org.waabox.chorus.schedule;

/**
 * A handle to a task submitted to a {@link TaskScheduler}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ScheduledTask {

  /**
   * Cancels the task. A run already in progress is not interrupted.
   * Calling this method more than once has no effect.
   */
  void cancel();

  /**
   * Tells whether {@link #cancel()} was called.
   *
   * @return true if the task was cancelled
   */
  boolean isCancelled();
}
