package org.waabox.chorus.schedule;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link TaskScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <p>The default instance runs every task on a single daemon thread named
 * {@code chorus-scheduler}. Tasks are expected to be short: refresh
 * operations hand their work off through a {@code CompletionStage} and
 * backoff waits are scheduled, not slept.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ExecutorTaskScheduler implements TaskScheduler {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(ExecutorTaskScheduler.class);

  /** The underlying executor, never null. */
  private final ScheduledExecutorService executor;

  /** The clock used for {@link #now()}, never null. */
  private final Clock clock;

  /**
   * Creates a scheduler over the given executor and clock.
   *
   * @param theExecutor the executor, never null
   * @param theClock    the clock, never null
   */
  public ExecutorTaskScheduler(final ScheduledExecutorService theExecutor,
      final Clock theClock) {
    executor = Objects.requireNonNull(theExecutor,
        "executor must not be null");
    clock = Objects.requireNonNull(theClock, "clock must not be null");
  }

  /**
   * Creates a scheduler with a single daemon thread and the UTC system
   * clock.
   *
   * @return a new scheduler, never null
   */
  public static ExecutorTaskScheduler create() {
    final ScheduledExecutorService executor =
        Executors.newSingleThreadScheduledExecutor(r -> {
          final Thread thread = new Thread(r, "chorus-scheduler");
          thread.setDaemon(true);
          return thread;
        });
    return new ExecutorTaskScheduler(executor, Clock.systemUTC());
  }

  /** {@inheritDoc} */
  @Override
  public ScheduledTask schedule(final Runnable task, final Duration delay) {
    Objects.requireNonNull(task, "task must not be null");
    Objects.requireNonNull(delay, "delay must not be null");
    return new FutureTask(executor.schedule(guard(task),
        Math.max(0L, delay.toMillis()), TimeUnit.MILLISECONDS));
  }

  /** {@inheritDoc} */
  @Override
  public ScheduledTask scheduleAtFixedRate(final Runnable task,
      final Duration initialDelay, final Duration period) {
    Objects.requireNonNull(task, "task must not be null");
    Objects.requireNonNull(initialDelay, "initialDelay must not be null");
    Objects.requireNonNull(period, "period must not be null");
    if (period.isZero() || period.isNegative()) {
      throw new IllegalArgumentException(
          "period must be positive, got: " + period);
    }
    return new FutureTask(executor.scheduleAtFixedRate(guard(task),
        Math.max(0L, initialDelay.toMillis()), period.toMillis(),
        TimeUnit.MILLISECONDS));
  }

  /** {@inheritDoc} */
  @Override
  public Instant now() {
    return clock.instant();
  }

  /** {@inheritDoc} */
  @Override
  public void shutdown() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (final InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Wraps a task so an exception is logged instead of silently cancelling
   * a periodic schedule.
   *
   * @param task the task to wrap, never null
   * @return the guarded task, never null
   */
  private static Runnable guard(final Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (final Exception e) {
        log.error("Scheduled task failed: {}", e.getMessage(), e);
      }
    };
  }

  /** A {@link ScheduledTask} over a {@link ScheduledFuture}. */
  private static final class FutureTask implements ScheduledTask {

    /** The wrapped future, never null. */
    private final ScheduledFuture<?> future;

    /** Creates a new handle.
     *
     * @param theFuture the future, never null
     */
    private FutureTask(final ScheduledFuture<?> theFuture) {
      future = theFuture;
    }

    @Override
    public void cancel() {
      future.cancel(false);
    }

    @Override
    public boolean isCancelled() {
      return future.isCancelled();
    }
  }
}
