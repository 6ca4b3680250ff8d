package org.waabox.chorus.audit;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.waabox.chorus.bus.ChangeNotice;

/**
 * A bounded, in-memory log of the local writes notified to the
 * synchronization layer.
 *
 * <p>Records are kept newest first. Once the capacity is reached the
 * oldest record is evicted. Deletes and bulk operations are flagged as
 * critical.
 *
 * <p>Thread safety: this class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class AdminActionLog {

  /** The default capacity. */
  public static final int DEFAULT_CAPACITY = 500;

  /** Actions considered destructive. */
  private static final Set<String> CRITICAL_ACTIONS = Set.of(
      "delete", "bulk_delete", "bulk_update", "purge");

  /** The maximum number of records. */
  private final int capacity;

  /** The records, newest first. Guarded by {@code this}. */
  private final Deque<AdminActionRecord> records = new ArrayDeque<>();

  /** Creates a log with the default capacity. */
  public AdminActionLog() {
    this(DEFAULT_CAPACITY);
  }

  /**
   * Creates a log with the given capacity.
   *
   * @param theCapacity the maximum number of records, greater than zero
   */
  public AdminActionLog(final int theCapacity) {
    if (theCapacity <= 0) {
      throw new IllegalArgumentException(
          "capacity must be greater than 0, got: " + theCapacity);
    }
    capacity = theCapacity;
  }

  /**
   * Records a local write.
   *
   * @param notice the notice synthesized for the write, never null
   * @return the stored record, never null
   */
  public AdminActionRecord record(final ChangeNotice notice) {
    Objects.requireNonNull(notice, "notice must not be null");

    final AdminActionRecord entry = new AdminActionRecord(
        notice.resource(), notice.action(), notice.occurredAt(),
        notice.payload(), isCritical(notice.action()));

    synchronized (this) {
      records.addFirst(entry);
      while (records.size() > capacity) {
        records.removeLast();
      }
    }
    return entry;
  }

  /**
   * Returns the most recent records.
   *
   * @param limit the maximum number of records, not negative
   * @return the records, newest first, never null
   */
  public synchronized List<AdminActionRecord> recent(final int limit) {
    requireLimit(limit);
    final List<AdminActionRecord> result = new ArrayList<>();
    for (final AdminActionRecord entry : records) {
      if (result.size() == limit) {
        break;
      }
      result.add(entry);
    }
    return Collections.unmodifiableList(result);
  }

  /**
   * Returns the most recent critical records.
   *
   * @param limit the maximum number of records, not negative
   * @return the critical records, newest first, never null
   */
  public synchronized List<AdminActionRecord> critical(final int limit) {
    requireLimit(limit);
    final List<AdminActionRecord> result = new ArrayList<>();
    for (final AdminActionRecord entry : records) {
      if (result.size() == limit) {
        break;
      }
      if (entry.critical()) {
        result.add(entry);
      }
    }
    return Collections.unmodifiableList(result);
  }

  /**
   * Returns the records within a time range.
   *
   * @param from the inclusive lower bound, never null
   * @param to   the inclusive upper bound, never null
   * @return the matching records, newest first, never null
   */
  public synchronized List<AdminActionRecord> between(final Instant from,
      final Instant to) {
    Objects.requireNonNull(from, "from must not be null");
    Objects.requireNonNull(to, "to must not be null");
    final List<AdminActionRecord> result = new ArrayList<>();
    for (final AdminActionRecord entry : records) {
      final Instant at = entry.recordedAt();
      if (!at.isBefore(from) && !at.isAfter(to)) {
        result.add(entry);
      }
    }
    return Collections.unmodifiableList(result);
  }

  /**
   * Aggregates the current records.
   *
   * @return the statistics, never null
   */
  public synchronized ActionStatistics statistics() {
    final Map<String, Long> byAction = new HashMap<>();
    final Map<String, Long> byResource = new HashMap<>();
    int critical = 0;
    for (final AdminActionRecord entry : records) {
      byAction.merge(entry.action(), 1L, Long::sum);
      byResource.merge(entry.resource(), 1L, Long::sum);
      if (entry.critical()) {
        critical++;
      }
    }
    return new ActionStatistics(records.size(), critical, byAction,
        byResource);
  }

  /**
   * Returns the number of records held.
   *
   * @return the size
   */
  public synchronized int size() {
    return records.size();
  }

  /** Removes every record. */
  public synchronized void clear() {
    records.clear();
  }

  /** Tells whether an action is destructive.
   *
   * @param action the action, never null
   * @return true for deletes and bulk operations
   */
  private static boolean isCritical(final String action) {
    return CRITICAL_ACTIONS.contains(action.toLowerCase(Locale.ROOT));
  }

  /** Validates a limit argument.
   *
   * @param limit the limit
   */
  private static void requireLimit(final int limit) {
    if (limit < 0) {
      throw new IllegalArgumentException(
          "limit must not be negative, got: " + limit);
    }
  }
}
