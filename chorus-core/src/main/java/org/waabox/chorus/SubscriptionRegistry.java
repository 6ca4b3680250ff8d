package org.waabox.chorus;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.chorus.audit.AdminActionLog;
import org.waabox.chorus.bus.ChangeNotice;
import org.waabox.chorus.bus.EventBus;
import org.waabox.chorus.bus.Topic;
import org.waabox.chorus.feed.ChangeFeed;
import org.waabox.chorus.metrics.ChorusMetrics;
import org.waabox.chorus.schedule.ScheduledTask;
import org.waabox.chorus.schedule.TaskScheduler;

/**
 * Owns one {@link ChangeFeedSubscription} per resource and turns local
 * writes into bus notifications.
 *
 * <p>The registry is started once per process. After {@link #shutdown()}
 * every operation becomes a logged no-op.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SubscriptionRegistry {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(SubscriptionRegistry.class);

  /** The backend feed, never null. */
  private final ChangeFeed changeFeed;

  /** The bus, never null. */
  private final EventBus eventBus;

  /** The scheduler for reconnects and delayed publications, never null. */
  private final TaskScheduler scheduler;

  /** The reconnect policy shared by every subscription, never null. */
  private final BackoffPolicy feedBackoff;

  /** The delay before the follow-up forceRefresh, never null. */
  private final Duration settleDelay;

  /** The local write log, never null. */
  private final AdminActionLog actionLog;

  /** The metrics reporter, never null. */
  private final ChorusMetrics metrics;

  /** Whether start was called. */
  private final AtomicBoolean started = new AtomicBoolean(false);

  /** Whether shutdown was called. */
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  /** The delayed publications not yet run. */
  private final Set<ScheduledTask> pending = ConcurrentHashMap.newKeySet();

  /** The subscriptions by resource, in start order. Immutable. */
  private volatile Map<String, ChangeFeedSubscription> subscriptions =
      Map.of();

  /** When the last local write was notified, null if none yet. */
  private volatile Instant lastLocalWriteAt;

  /**
   * Creates a new registry. Nothing is opened until {@link #start(Set)}.
   *
   * @param theChangeFeed  the backend feed, never null
   * @param theEventBus    the bus, never null
   * @param theScheduler   the scheduler, never null
   * @param theFeedBackoff the reconnect policy, never null
   * @param theSettleDelay the delay before the follow-up forceRefresh,
   *                       never null nor negative
   * @param theActionLog   the local write log, never null
   * @param theMetrics     the metrics reporter, never null
   */
  public SubscriptionRegistry(final ChangeFeed theChangeFeed,
      final EventBus theEventBus, final TaskScheduler theScheduler,
      final BackoffPolicy theFeedBackoff, final Duration theSettleDelay,
      final AdminActionLog theActionLog, final ChorusMetrics theMetrics) {
    changeFeed = Objects.requireNonNull(theChangeFeed,
        "changeFeed must not be null");
    eventBus = Objects.requireNonNull(theEventBus,
        "eventBus must not be null");
    scheduler = Objects.requireNonNull(theScheduler,
        "scheduler must not be null");
    feedBackoff = Objects.requireNonNull(theFeedBackoff,
        "feedBackoff must not be null");
    settleDelay = Objects.requireNonNull(theSettleDelay,
        "settleDelay must not be null");
    if (theSettleDelay.isNegative()) {
      throw new IllegalArgumentException(
          "settleDelay must not be negative, got: " + theSettleDelay);
    }
    actionLog = Objects.requireNonNull(theActionLog,
        "actionLog must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
  }

  /**
   * Opens one subscription per resource.
   *
   * <p>Only the first call has an effect. Connect failures do not
   * propagate: the affected subscription retries on its own.
   *
   * @param resources the resources to subscribe to, never null
   */
  public void start(final Set<String> resources) {
    Objects.requireNonNull(resources, "resources must not be null");

    if (stopped.get()) {
      log.warn("SubscriptionRegistry already shut down, ignoring start");
      return;
    }
    if (!started.compareAndSet(false, true)) {
      log.warn("SubscriptionRegistry already started, ignoring start");
      return;
    }

    final Map<String, ChangeFeedSubscription> created = new LinkedHashMap<>();
    for (final String resource : resources) {
      created.put(resource, new ChangeFeedSubscription(resource, changeFeed,
          eventBus, scheduler, feedBackoff, metrics));
    }
    subscriptions = Collections.unmodifiableMap(created);

    for (final ChangeFeedSubscription subscription : created.values()) {
      subscription.open();
    }
    log.info("SubscriptionRegistry started with {} resource(s): {}",
        created.size(), created.keySet());
  }

  /**
   * Announces a local write, with no payload.
   *
   * @param resource the resource written, never null
   * @param reason   the action, never null
   * @see #notifyExternal(String, String, Map)
   */
  public void notifyExternal(final String resource, final String reason) {
    notifyExternal(resource, reason, Map.of());
  }

  /**
   * Announces a local write.
   *
   * <p>Publishes {@code "<resource>Changed"}, {@code "dataChanged"} and
   * {@code "adminActionCompleted"}, in that order and on the caller's
   * thread, then schedules a {@code "forceRefresh"} after the settle
   * delay. Ignored after shutdown.
   *
   * @param resource the resource written, never null nor blank
   * @param reason   the action, never null
   * @param payload  extra details, never null
   * @throws IllegalArgumentException if the resource is blank
   */
  public void notifyExternal(final String resource, final String reason,
      final Map<String, String> payload) {
    Objects.requireNonNull(resource, "resource must not be null");
    Objects.requireNonNull(reason, "reason must not be null");
    Objects.requireNonNull(payload, "payload must not be null");
    if (resource.isBlank()) {
      throw new IllegalArgumentException("resource must not be blank");
    }

    if (stopped.get()) {
      log.warn("SubscriptionRegistry shut down, ignoring write on '{}'",
          resource);
      return;
    }

    final Instant now = scheduler.now();
    final ChangeNotice notice = ChangeNotice.localWrite(resource, reason,
        now, payload);
    actionLog.record(notice);
    lastLocalWriteAt = now;

    log.debug("Local write on '{}': {}", resource, reason);
    eventBus.publish(Topic.changed(resource), notice);
    eventBus.publish(Topic.DATA_CHANGED, notice);
    eventBus.publish(Topic.ADMIN_ACTION_COMPLETED, notice);

    scheduleForceRefresh();
  }

  /**
   * Cancels pending publications, closes every subscription and shuts the
   * feed down. Idempotent.
   */
  public void shutdown() {
    if (!stopped.compareAndSet(false, true)) {
      log.debug("SubscriptionRegistry already shut down");
      return;
    }

    for (final ScheduledTask task : pending) {
      task.cancel();
    }
    pending.clear();

    for (final ChangeFeedSubscription subscription
        : subscriptions.values()) {
      subscription.close();
    }

    try {
      changeFeed.shutdown();
    } catch (final Exception e) {
      log.warn("Error shutting down the change-feed: {}", e.getMessage(), e);
    }
    log.info("SubscriptionRegistry shut down");
  }

  /**
   * Re-opens one subscription, typically after it failed permanently.
   *
   * @param resource the resource, never null
   * @return true if the resource is known and a connect was attempted
   */
  public boolean reopen(final String resource) {
    Objects.requireNonNull(resource, "resource must not be null");
    if (stopped.get()) {
      log.warn("SubscriptionRegistry shut down, ignoring reopen of '{}'",
          resource);
      return false;
    }
    final ChangeFeedSubscription subscription = subscriptions.get(resource);
    if (subscription == null) {
      log.warn("No subscription for resource '{}'", resource);
      return false;
    }
    log.info("Re-opening subscription of '{}'", resource);
    subscription.open();
    return true;
  }

  /**
   * Returns the state of every subscription.
   *
   * @return the states by resource, in start order, never null, immutable
   */
  public Map<String, SubscriptionState> status() {
    final Map<String, SubscriptionState> result = new LinkedHashMap<>();
    subscriptions.forEach((resource, subscription) ->
        result.put(resource, subscription.state()));
    return Collections.unmodifiableMap(result);
  }

  /**
   * Returns an aggregate view of the layer.
   *
   * @return the status, never null
   */
  public SyncStatus syncStatus() {
    Instant last = lastLocalWriteAt;
    for (final ChangeFeedSubscription subscription
        : subscriptions.values()) {
      final Instant changed = subscription.lastChangeAt();
      if (changed != null && (last == null || changed.isAfter(last))) {
        last = changed;
      }
    }
    return new SyncStatus(isActive(), last, eventBus.listenerCount(),
        status());
  }

  /**
   * Tells whether the registry is started and not shut down.
   *
   * @return true while running
   */
  public boolean isActive() {
    return started.get() && !stopped.get();
  }

  /** Schedules the follow-up forceRefresh publication. */
  private void scheduleForceRefresh() {
    final DelayedPublication publication = new DelayedPublication();
    final ScheduledTask task = scheduler.schedule(publication, settleDelay);
    publication.track(task);
  }

  /** A forceRefresh publication that unregisters itself once run. */
  private final class DelayedPublication implements Runnable {

    /** The scheduled task, set right after scheduling. */
    private ScheduledTask task;

    /** Whether the publication already ran. */
    private boolean done;

    /** Registers the task as pending unless it already ran.
     *
     * @param theTask the scheduled task, never null
     */
    private synchronized void track(final ScheduledTask theTask) {
      task = theTask;
      if (!done) {
        pending.add(theTask);
      }
    }

    @Override
    public void run() {
      synchronized (this) {
        done = true;
        if (task != null) {
          pending.remove(task);
        }
      }
      if (stopped.get()) {
        return;
      }
      eventBus.publish(Topic.FORCE_REFRESH);
    }
  }
}
