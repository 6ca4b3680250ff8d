package org.waabox.chorus.schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * A {@link TaskScheduler} driven by a virtual clock.
 *
 * <p>Nothing runs until {@link #advance(Duration)} moves the clock; due
 * tasks then run on the calling thread, in time order.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ManualTaskScheduler implements TaskScheduler {

  /** The pending tasks. Guarded by {@code this}. */
  private final List<Entry> entries = new ArrayList<>();

  /** The virtual time. */
  private Instant now;

  /** Keeps the insertion order of tasks due at the same instant. */
  private long sequence;

  /** Whether shutdown was called. */
  private boolean shutdown;

  /** Creates a scheduler starting at a fixed instant. */
  public ManualTaskScheduler() {
    this(Instant.parse("2024-01-01T00:00:00Z"));
  }

  /**
   * Creates a scheduler starting at the given instant.
   *
   * @param start the initial virtual time, never null
   */
  public ManualTaskScheduler(final Instant start) {
    now = start;
  }

  @Override
  public synchronized ScheduledTask schedule(final Runnable task,
      final Duration delay) {
    final Entry entry = new Entry(task, now.plus(delay), null, sequence++);
    entries.add(entry);
    return entry;
  }

  @Override
  public synchronized ScheduledTask scheduleAtFixedRate(final Runnable task,
      final Duration initialDelay, final Duration period) {
    final Entry entry = new Entry(task, now.plus(initialDelay), period,
        sequence++);
    entries.add(entry);
    return entry;
  }

  @Override
  public synchronized Instant now() {
    return now;
  }

  @Override
  public synchronized void shutdown() {
    shutdown = true;
    entries.clear();
  }

  /**
   * Moves the clock forward, running every task that becomes due.
   *
   * @param duration how far to move, never null
   */
  public void advance(final Duration duration) {
    final Instant target;
    synchronized (this) {
      target = now.plus(duration);
    }
    while (true) {
      final Entry next;
      synchronized (this) {
        next = entries.stream()
            .filter(entry -> !entry.due.isAfter(target))
            .min(Comparator.comparing((Entry entry) -> entry.due)
                .thenComparingLong(entry -> entry.order))
            .orElse(null);
        if (next == null) {
          now = target;
          return;
        }
        now = next.due;
        if (next.period == null) {
          entries.remove(next);
        } else {
          next.due = next.due.plus(next.period);
        }
      }
      next.task.run();
    }
  }

  /** Runs every task due at the current instant. */
  public void runDue() {
    advance(Duration.ZERO);
  }

  /**
   * Returns the number of tasks waiting to run.
   *
   * @return the pending count
   */
  public synchronized int pendingCount() {
    return entries.size();
  }

  /**
   * Tells whether shutdown was called.
   *
   * @return true after shutdown
   */
  public synchronized boolean isShutdown() {
    return shutdown;
  }

  /** A pending task. */
  private final class Entry implements ScheduledTask {

    /** The code to run. */
    private final Runnable task;

    /** The period, null for one-shot tasks. */
    private final Duration period;

    /** The insertion order. */
    private final long order;

    /** When the task runs next. */
    private Instant due;

    /** Whether the task was cancelled. */
    private volatile boolean cancelled;

    private Entry(final Runnable theTask, final Instant theDue,
        final Duration thePeriod, final long theOrder) {
      task = theTask;
      due = theDue;
      period = thePeriod;
      order = theOrder;
    }

    @Override
    public void cancel() {
      cancelled = true;
      synchronized (ManualTaskScheduler.this) {
        entries.remove(this);
      }
    }

    @Override
    public boolean isCancelled() {
      return cancelled;
    }
  }
}
