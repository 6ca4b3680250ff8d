package org.waabox.chorus;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.chorus.bus.ChangeNotice;
import org.waabox.chorus.bus.EventBus;
import org.waabox.chorus.bus.Topic;
import org.waabox.chorus.feed.ChangeFeed;
import org.waabox.chorus.feed.ChangeFeedHandle;
import org.waabox.chorus.feed.ChangeFeedListener;
import org.waabox.chorus.feed.ChangePayload;
import org.waabox.chorus.metrics.ChorusMetrics;
import org.waabox.chorus.schedule.ScheduledTask;
import org.waabox.chorus.schedule.TaskScheduler;

/**
 * Maintains a single live subscription to one resource's change-feed and
 * republishes its changes on the {@link EventBus}.
 *
 * <p>Every change is published as {@code "<resource>Changed"} followed by
 * {@code "dataChanged"}. Connection failures, both when opening and after
 * the handle is live, are retried according to the {@link BackoffPolicy}:
 * the wait after the n-th consecutive failure is
 * {@code baseDelay * multiplier^(n-1)}. Once the policy is exhausted the
 * subscription stays {@link SubscriptionState#FAILED} until {@link #open()}
 * is called again.
 *
 * <p>At most one handle is live at any time. Every connect attempt first
 * releases the previous handle, and callbacks from a released handle are
 * ignored.
 *
 * <p>Thread safety: this class is thread-safe. State transitions happen
 * under the subscription's own lock; the feed is opened and closed outside
 * of it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ChangeFeedSubscription {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(ChangeFeedSubscription.class);

  /** The subscribed resource, never null. */
  private final String resource;

  /** The backend feed, never null. */
  private final ChangeFeed changeFeed;

  /** The bus changes are republished on, never null. */
  private final EventBus eventBus;

  /** The scheduler for reconnect delays, never null. */
  private final TaskScheduler scheduler;

  /** The reconnect policy, never null. */
  private final BackoffPolicy backoff;

  /** The metrics reporter, never null. */
  private final ChorusMetrics metrics;

  /** Guards every mutable field below. */
  private final Object lock = new Object();

  /** The current state. */
  private SubscriptionState state = SubscriptionState.IDLE;

  /** Consecutive connection failures since the last success. */
  private int retryCount;

  /** The live handle, null unless connected. */
  private ChangeFeedHandle handle;

  /** The pending reconnect, null if none. */
  private ScheduledTask pendingRetry;

  /** Incremented on every open and close; stale callbacks compare it. */
  private long generation;

  /** When the last change was delivered, null if none yet. */
  private volatile Instant lastChangeAt;

  /**
   * Creates a new, idle subscription.
   *
   * @param theResource   the resource to subscribe to, never null or blank
   * @param theChangeFeed the backend feed, never null
   * @param theEventBus   the bus to publish on, never null
   * @param theScheduler  the scheduler for reconnect delays, never null
   * @param theBackoff    the reconnect policy, never null
   * @param theMetrics    the metrics reporter, never null
   */
  public ChangeFeedSubscription(final String theResource,
      final ChangeFeed theChangeFeed, final EventBus theEventBus,
      final TaskScheduler theScheduler, final BackoffPolicy theBackoff,
      final ChorusMetrics theMetrics) {
    resource = Objects.requireNonNull(theResource,
        "resource must not be null");
    if (theResource.isBlank()) {
      throw new IllegalArgumentException("resource must not be blank");
    }
    changeFeed = Objects.requireNonNull(theChangeFeed,
        "changeFeed must not be null");
    eventBus = Objects.requireNonNull(theEventBus,
        "eventBus must not be null");
    scheduler = Objects.requireNonNull(theScheduler,
        "scheduler must not be null");
    backoff = Objects.requireNonNull(theBackoff, "backoff must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
  }

  /**
   * Opens the subscription, releasing any existing handle first.
   *
   * <p>Resets the failure count, so a subscription that gave up can be
   * brought back with this method. Never throws: a failed attempt moves the
   * subscription to {@link SubscriptionState#FAILED} and schedules a retry.
   */
  public void open() {
    connect(true);
  }

  /**
   * Releases the handle and cancels any pending reconnect. Idempotent.
   */
  public void close() {
    final ChangeFeedHandle previous;
    synchronized (lock) {
      generation++;
      cancelPendingRetry();
      previous = handle;
      handle = null;
      transition(SubscriptionState.IDLE);
    }
    release(previous);
  }

  /**
   * Returns the subscribed resource.
   *
   * @return the resource, never null
   */
  public String resource() {
    return resource;
  }

  /**
   * Returns the current state.
   *
   * @return the state, never null
   */
  public SubscriptionState state() {
    synchronized (lock) {
      return state;
    }
  }

  /**
   * Returns the consecutive connection failures since the last success.
   *
   * @return the failure count, not negative
   */
  public int retryCount() {
    synchronized (lock) {
      return retryCount;
    }
  }

  /**
   * Returns when the last change was delivered.
   *
   * @return the instant, or null if no change arrived yet
   */
  public Instant lastChangeAt() {
    return lastChangeAt;
  }

  /**
   * Runs one connect attempt.
   *
   * @param explicit true when requested by a caller, false for a retry
   */
  private void connect(final boolean explicit) {
    final ChangeFeedHandle previous;
    final long attempt;
    synchronized (lock) {
      if (explicit) {
        retryCount = 0;
        cancelPendingRetry();
      }
      previous = handle;
      handle = null;
      attempt = ++generation;
      transition(SubscriptionState.CONNECTING);
    }
    release(previous);

    final ChangeFeedHandle opened;
    try {
      opened = changeFeed.open(resource, new HandleListener(attempt));
    } catch (final Exception e) {
      fail(attempt, e);
      return;
    }

    boolean stale = false;
    synchronized (lock) {
      if (generation != attempt || state != SubscriptionState.CONNECTING) {
        stale = true;
      } else {
        handle = opened;
        retryCount = 0;
        transition(SubscriptionState.ACTIVE);
      }
    }
    if (stale) {
      log.debug("Discarding stale handle for '{}'", resource);
      release(opened);
    } else {
      log.info("Subscribed to change-feed of '{}'", resource);
    }
  }

  /**
   * Handles a failed connect attempt or a broken live handle.
   *
   * @param attempt the generation the failure belongs to
   * @param cause   the failure, never null
   */
  private void fail(final long attempt, final Throwable cause) {
    final ChangeFeedHandle broken;
    synchronized (lock) {
      if (generation != attempt) {
        log.debug("Ignoring failure of a released handle for '{}'",
            resource);
        return;
      }
      broken = handle;
      handle = null;
      retryCount++;
      transition(SubscriptionState.FAILED);

      if (backoff.allowsRetry(retryCount)) {
        final Duration delay = backoff.delayBeforeRetry(retryCount);
        log.warn("Change-feed of '{}' failed (attempt {}/{}), retrying in"
            + " {} ms: {}", resource, retryCount, backoff.maxAttempts(),
            delay.toMillis(), cause.getMessage());
        pendingRetry = scheduler.schedule(() -> retry(attempt), delay);
      } else {
        log.error("Change-feed of '{}' failed {} consecutive times, giving"
            + " up until reopened", resource, retryCount, cause);
      }
    }
    release(broken);
  }

  /**
   * Runs a scheduled reconnect, unless the subscription moved on.
   *
   * @param attempt the generation that scheduled the retry
   */
  private void retry(final long attempt) {
    synchronized (lock) {
      if (generation != attempt) {
        return;
      }
      pendingRetry = null;
    }
    connect(false);
  }

  /**
   * Republishes one change. Never throws.
   *
   * @param attempt the generation of the delivering handle
   * @param payload the change, never null
   */
  private void deliver(final long attempt, final ChangePayload payload) {
    synchronized (lock) {
      if (generation != attempt) {
        log.debug("Ignoring change from a released handle for '{}'",
            resource);
        return;
      }
    }
    try {
      lastChangeAt = payload.occurredAt();
      final ChangeNotice notice = new ChangeNotice(resource,
          payload.action(), ChangeNotice.Origin.FEED, payload.occurredAt(),
          payload.attributes());
      log.debug("Change detected for '{}': {}", resource, payload.action());
      eventBus.publish(Topic.changed(resource), notice);
      eventBus.publish(Topic.DATA_CHANGED, notice);
    } catch (final Exception e) {
      log.error("Failed to republish change of '{}': {}", resource,
          e.getMessage(), e);
    }
  }

  /** Moves to a new state. Must be called holding the lock.
   *
   * @param next the new state, never null
   */
  private void transition(final SubscriptionState next) {
    if (state == next) {
      return;
    }
    log.debug("Subscription '{}': {} -> {}", resource, state, next);
    state = next;
    metrics.subscriptionStateChanged(resource, next);
  }

  /** Cancels the pending reconnect. Must be called holding the lock. */
  private void cancelPendingRetry() {
    if (pendingRetry != null) {
      pendingRetry.cancel();
      pendingRetry = null;
    }
  }

  /** Closes a handle, logging failures.
   *
   * @param target the handle, may be null
   */
  private void release(final ChangeFeedHandle target) {
    if (target == null) {
      return;
    }
    try {
      changeFeed.close(target);
    } catch (final Exception e) {
      log.warn("Error closing change-feed handle of '{}': {}", resource,
          e.getMessage(), e);
    }
  }

  /** Routes the callbacks of one handle, tagged with its generation. */
  private final class HandleListener implements ChangeFeedListener {

    /** The generation of the handle. */
    private final long attempt;

    /** Creates a new listener.
     *
     * @param theAttempt the generation of the handle
     */
    private HandleListener(final long theAttempt) {
      attempt = theAttempt;
    }

    @Override
    public void onChange(final ChangePayload payload) {
      deliver(attempt, payload);
    }

    @Override
    public void onFailure(final Throwable cause) {
      fail(attempt, cause);
    }
  }
}
