package org.waabox.chorus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.chorus.bus.EventBus;
import org.waabox.chorus.bus.ListenerToken;
import org.waabox.chorus.bus.Topic;
import org.waabox.chorus.health.HealthGate;
import org.waabox.chorus.metrics.ChorusMetrics;
import org.waabox.chorus.schedule.ScheduledTask;
import org.waabox.chorus.schedule.TaskScheduler;

/**
 * Decides when one consumer's {@link RefreshOperation} runs.
 *
 * <p>A coordinator refreshes once on creation, then on every tick of its
 * periodic timer and on every relevant bus event: the resource's own
 * {@code "<resource>Changed"} topic (when a resource was given),
 * {@code "dataChanged"}, {@code "forceRefresh"} and
 * {@code "adminActionCompleted"}.
 *
 * <p>Refreshes of one coordinator never overlap. A trigger that arrives
 * while a refresh, including its retries, is running is dropped and
 * reported as {@link RefreshOutcome#SKIPPED_BUSY}; the next tick or event
 * picks the change up. A failed refresh is retried according to the
 * {@link BackoffPolicy}; once the policy is exhausted the failure is logged
 * and the previously loaded data stays in place.
 *
 * <p>While paused, periodic and event triggers are dropped but
 * {@link #manualRefresh()} still runs. Periodic triggers are also dropped
 * while the {@link HealthGate} reports the backend as unhealthy.
 *
 * <p>{@link #dispose()} must be called when the consumer goes away.
 *
 * <p>Thread safety: this class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RefreshCoordinator {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(RefreshCoordinator.class);

  /** What started a refresh. */
  private enum Trigger {

    /** The refresh run on creation. */
    INITIAL,

    /** A tick of the periodic timer. */
    PERIODIC,

    /** A bus event. */
    EVENT,

    /** An explicit caller request. */
    MANUAL
  }

  /** The label used in logs and metrics, never null. */
  private final String ownerLabel;

  /** The consumer's refresh code, never null. */
  private final RefreshOperation operation;

  /** The scheduler for the timer and the retry delays, never null. */
  private final TaskScheduler scheduler;

  /** The retry policy, never null. */
  private final BackoffPolicy backoff;

  /** The gate consulted by periodic triggers, never null. */
  private final HealthGate healthGate;

  /** The metrics reporter, never null. */
  private final ChorusMetrics metrics;

  /** Called once the coordinator is disposed, never null. */
  private final Consumer<RefreshCoordinator> onDispose;

  /** True while one refresh, retries included, is running. */
  private final AtomicBoolean inProgress = new AtomicBoolean(false);

  /** False while paused. */
  private final AtomicBoolean active = new AtomicBoolean(true);

  /** True once disposed. */
  private final AtomicBoolean disposed = new AtomicBoolean(false);

  /** Consecutive failures within the current refresh. */
  private final AtomicInteger retryCount = new AtomicInteger(0);

  /** The bus registrations, cancelled on dispose. */
  private final List<ListenerToken> tokens = new CopyOnWriteArrayList<>();

  /** The outcome of the running refresh, null when idle. */
  private final AtomicReference<CompletableFuture<RefreshOutcome>> current =
      new AtomicReference<>();

  /** Guards {@link #pendingRetry}. */
  private final Object retryLock = new Object();

  /** The waiting retry, null if none. Guarded by {@link #retryLock}. */
  private ScheduledTask pendingRetry;

  /** The periodic timer, null until started. */
  private volatile ScheduledTask timer;

  /** When the last successful refresh finished, null if none yet. */
  private volatile Instant lastRefreshAt;

  /**
   * Creates a coordinator, not yet wired. See {@link #create}.
   *
   * @param theOwnerLabel the label, never null
   * @param theOperation  the refresh code, never null
   * @param theScheduler  the scheduler, never null
   * @param theBackoff    the retry policy, never null
   * @param theHealthGate the health gate, never null
   * @param theMetrics    the metrics reporter, never null
   * @param theOnDispose  the dispose callback, never null
   */
  private RefreshCoordinator(final String theOwnerLabel,
      final RefreshOperation theOperation, final TaskScheduler theScheduler,
      final BackoffPolicy theBackoff, final HealthGate theHealthGate,
      final ChorusMetrics theMetrics,
      final Consumer<RefreshCoordinator> theOnDispose) {
    ownerLabel = theOwnerLabel;
    operation = theOperation;
    scheduler = theScheduler;
    backoff = theBackoff;
    healthGate = theHealthGate;
    metrics = theMetrics;
    onDispose = theOnDispose;
  }

  /**
   * Creates a coordinator, subscribes it to the bus, starts its timer and
   * runs the initial refresh.
   *
   * @param ownerLabel the label used in logs and metrics, never null
   * @param operation  the refresh code, never null
   * @param interval   the period of the timer, must be positive
   * @param resource   the watched resource, or null for generic topics only
   * @param eventBus   the bus to listen on, never null
   * @param scheduler  the scheduler, never null
   * @param backoff    the retry policy, never null
   * @param healthGate the gate consulted by periodic triggers, never null
   * @param metrics    the metrics reporter, never null
   * @param onDispose  called once when disposed, never null
   * @return the running coordinator, never null
   */
  static RefreshCoordinator create(final String ownerLabel,
      final RefreshOperation operation, final Duration interval,
      final String resource, final EventBus eventBus,
      final TaskScheduler scheduler, final BackoffPolicy backoff,
      final HealthGate healthGate, final ChorusMetrics metrics,
      final Consumer<RefreshCoordinator> onDispose) {
    Objects.requireNonNull(ownerLabel, "ownerLabel must not be null");
    Objects.requireNonNull(operation, "operation must not be null");
    Objects.requireNonNull(interval, "interval must not be null");
    Objects.requireNonNull(eventBus, "eventBus must not be null");
    Objects.requireNonNull(scheduler, "scheduler must not be null");
    Objects.requireNonNull(backoff, "backoff must not be null");
    Objects.requireNonNull(healthGate, "healthGate must not be null");
    Objects.requireNonNull(metrics, "metrics must not be null");
    Objects.requireNonNull(onDispose, "onDispose must not be null");
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException(
          "interval must be positive, got: " + interval);
    }

    final RefreshCoordinator coordinator = new RefreshCoordinator(ownerLabel,
        operation, scheduler, backoff, healthGate, metrics, onDispose);

    if (resource != null) {
      coordinator.listenTo(eventBus, Topic.changed(resource));
    }
    coordinator.listenTo(eventBus, Topic.DATA_CHANGED);
    coordinator.listenTo(eventBus, Topic.FORCE_REFRESH);
    coordinator.listenTo(eventBus, Topic.ADMIN_ACTION_COMPLETED);

    coordinator.timer = scheduler.scheduleAtFixedRate(
        () -> coordinator.trigger(Trigger.PERIODIC), interval, interval);

    log.debug("RefreshCoordinator '{}' created, refreshing every {} ms",
        ownerLabel, interval.toMillis());

    coordinator.trigger(Trigger.INITIAL);
    return coordinator;
  }

  /**
   * Runs a refresh unless paused, disposed or already refreshing.
   *
   * <p>Behaves like a bus-driven trigger: the health gate is not
   * consulted.
   *
   * @return the outcome, never completes exceptionally
   */
  public CompletionStage<RefreshOutcome> guardedRefresh() {
    return trigger(Trigger.EVENT);
  }

  /**
   * Runs a refresh now, even while paused or while the backend is
   * reported unhealthy. Still dropped if a refresh is already running.
   *
   * @return the outcome, never completes exceptionally
   */
  public CompletionStage<RefreshOutcome> manualRefresh() {
    return trigger(Trigger.MANUAL);
  }

  /**
   * Same as {@link #manualRefresh()}.
   *
   * @return the outcome, never completes exceptionally
   */
  public CompletionStage<RefreshOutcome> forceSync() {
    return manualRefresh();
  }

  /**
   * Stops periodic and event-driven refreshes. A running refresh is not
   * interrupted.
   */
  public void pause() {
    if (active.compareAndSet(true, false)) {
      log.info("RefreshCoordinator '{}' paused", ownerLabel);
    }
  }

  /** Lets periodic and event-driven refreshes run again. */
  public void resume() {
    if (active.compareAndSet(false, true)) {
      log.info("RefreshCoordinator '{}' resumed", ownerLabel);
    }
  }

  /**
   * Cancels the timer, any waiting retry and every bus registration.
   *
   * <p>A refresh already running is allowed to finish, but nothing is
   * re-armed afterwards. Calling this more than once has no effect.
   */
  public void dispose() {
    if (!disposed.compareAndSet(false, true)) {
      log.debug("RefreshCoordinator '{}' already disposed", ownerLabel);
      return;
    }

    final ScheduledTask periodic = timer;
    if (periodic != null) {
      periodic.cancel();
    }
    for (final ListenerToken token : tokens) {
      token.cancel();
    }
    tokens.clear();

    final ScheduledTask retry;
    synchronized (retryLock) {
      retry = pendingRetry;
      pendingRetry = null;
    }
    if (retry != null) {
      retry.cancel();
      final CompletableFuture<RefreshOutcome> waiting = current.get();
      if (waiting != null) {
        finish(waiting, RefreshOutcome.DISPOSED);
      }
    }

    try {
      onDispose.accept(this);
    } catch (final Exception e) {
      log.warn("Dispose callback of '{}' failed: {}", ownerLabel,
          e.getMessage(), e);
    }
    log.debug("RefreshCoordinator '{}' disposed", ownerLabel);
  }

  /**
   * Returns when the last successful refresh finished.
   *
   * @return the instant, or null if no refresh succeeded yet
   */
  public Instant lastRefreshAt() {
    return lastRefreshAt;
  }

  /**
   * Tells whether a refresh, or its retry wait, is in progress.
   *
   * @return true while refreshing
   */
  public boolean isRefreshing() {
    return inProgress.get();
  }

  /**
   * Tells whether periodic and event triggers are honored.
   *
   * @return false while paused
   */
  public boolean isActive() {
    return active.get();
  }

  /**
   * Tells whether {@link #dispose()} was called.
   *
   * @return true once disposed
   */
  public boolean isDisposed() {
    return disposed.get();
  }

  /**
   * Returns the consecutive failures of the current, or last, refresh.
   *
   * @return the failure count, 0 after a success
   */
  public int retryCount() {
    return retryCount.get();
  }

  /**
   * Returns the label used in logs and metrics.
   *
   * @return the label, never null
   */
  public String ownerLabel() {
    return ownerLabel;
  }

  @Override
  public String toString() {
    return "RefreshCoordinator{owner=" + ownerLabel
        + ", active=" + active.get()
        + ", refreshing=" + inProgress.get()
        + ", disposed=" + disposed.get() + "}";
  }

  /** Registers a bus listener that triggers a refresh.
   *
   * @param eventBus the bus, never null
   * @param topic    the topic, never null
   */
  private void listenTo(final EventBus eventBus, final Topic topic) {
    tokens.add(eventBus.subscribe(topic, event -> trigger(Trigger.EVENT)));
  }

  /**
   * Applies the guards and starts a refresh.
   *
   * @param trigger what started it, never null
   * @return the outcome, never completes exceptionally
   */
  private CompletionStage<RefreshOutcome> trigger(final Trigger trigger) {
    if (disposed.get()) {
      log.debug("RefreshCoordinator '{}' disposed, ignoring {} trigger",
          ownerLabel, trigger);
      return CompletableFuture.completedFuture(RefreshOutcome.DISPOSED);
    }
    if (trigger != Trigger.MANUAL && !active.get()) {
      return skip(trigger, RefreshOutcome.SKIPPED_PAUSED);
    }
    if (!inProgress.compareAndSet(false, true)) {
      return skip(trigger, RefreshOutcome.SKIPPED_BUSY);
    }
    if (trigger == Trigger.PERIODIC && !backendHealthy()) {
      inProgress.set(false);
      log.warn("Backend unhealthy, skipping periodic refresh of '{}'",
          ownerLabel);
      return skip(trigger, RefreshOutcome.SKIPPED_UNHEALTHY);
    }

    final CompletableFuture<RefreshOutcome> outcome = new CompletableFuture<>();
    current.set(outcome);
    retryCount.set(0);
    log.debug("Refreshing '{}' ({})", ownerLabel, trigger);
    attempt(outcome);
    return outcome;
  }

  /**
   * Runs the operation once.
   *
   * @param outcome the outcome of the running refresh, never null
   */
  private void attempt(final CompletableFuture<RefreshOutcome> outcome) {
    if (disposed.get() && retryCount.get() > 0) {
      finish(outcome, RefreshOutcome.DISPOSED);
      return;
    }

    final CompletionStage<?> stage;
    try {
      stage = Objects.requireNonNull(operation.refresh(),
          "refresh operation returned null");
    } catch (final Exception e) {
      onFailure(outcome, e);
      return;
    }

    stage.whenComplete((result, error) -> {
      if (error == null) {
        onSuccess(outcome);
      } else {
        onFailure(outcome, unwrap(error));
      }
    });
  }

  /**
   * Records a successful attempt.
   *
   * @param outcome the outcome of the running refresh, never null
   */
  private void onSuccess(final CompletableFuture<RefreshOutcome> outcome) {
    final int attempts = retryCount.get() + 1;
    lastRefreshAt = scheduler.now();
    retryCount.set(0);
    report(() -> metrics.refreshSucceeded(ownerLabel, attempts));
    log.debug("Refresh of '{}' succeeded after {} attempt(s)", ownerLabel,
        attempts);
    finish(outcome, RefreshOutcome.SUCCEEDED);
  }

  /**
   * Records a failed attempt and either schedules a retry or gives up.
   *
   * @param outcome the outcome of the running refresh, never null
   * @param cause   the failure, never null
   */
  private void onFailure(final CompletableFuture<RefreshOutcome> outcome,
      final Throwable cause) {
    final int failures = retryCount.incrementAndGet();

    if (!backoff.allowsRetry(failures)) {
      log.error("Refresh of '{}' failed after {} attempt(s), keeping the"
          + " previously loaded data", ownerLabel, failures, cause);
      report(() -> metrics.refreshFailed(ownerLabel, cause));
      finish(outcome, RefreshOutcome.FAILED);
      return;
    }

    final Duration delay = backoff.delayBeforeRetry(failures);
    log.warn("Refresh of '{}' failed (attempt {}/{}), retrying in {} ms: {}",
        ownerLabel, failures, backoff.maxAttempts(), delay.toMillis(),
        cause.getMessage());

    synchronized (retryLock) {
      if (disposed.get()) {
        finish(outcome, RefreshOutcome.DISPOSED);
        return;
      }
      pendingRetry = scheduler.schedule(() -> {
        synchronized (retryLock) {
          pendingRetry = null;
        }
        attempt(outcome);
      }, delay);
    }
  }

  /**
   * Completes the running refresh and releases the in-progress flag.
   *
   * @param outcome the outcome to complete, never null
   * @param result  the result, never null
   */
  private void finish(final CompletableFuture<RefreshOutcome> outcome,
      final RefreshOutcome result) {
    if (current.compareAndSet(outcome, null)) {
      inProgress.set(false);
    }
    outcome.complete(result);
  }

  /**
   * Reports a dropped trigger.
   *
   * @param trigger what started it, never null
   * @param result  why it was dropped, never null
   * @return a completed outcome, never null
   */
  private CompletionStage<RefreshOutcome> skip(final Trigger trigger,
      final RefreshOutcome result) {
    log.debug("Dropping {} trigger of '{}': {}", trigger, ownerLabel, result);
    report(() -> metrics.refreshSkipped(ownerLabel, result));
    return CompletableFuture.completedFuture(result);
  }

  /** Reads the health gate. A gate that throws counts as unhealthy.
   *
   * @return true if the backend is reported healthy
   */
  private boolean backendHealthy() {
    try {
      return healthGate.isHealthy();
    } catch (final RuntimeException e) {
      log.warn("Health gate of '{}' failed, assuming unhealthy: {}",
          ownerLabel, e.getMessage(), e);
      return false;
    }
  }

  /** Hands one event to the metrics reporter, logging its failures.
   *
   * @param event the call to the reporter, never null
   */
  private void report(final Runnable event) {
    try {
      event.run();
    } catch (final RuntimeException e) {
      log.warn("Metrics reporter failed for '{}': {}", ownerLabel,
          e.getMessage(), e);
    }
  }

  /** Strips the wrappers added by the completion stages.
   *
   * @param error the error, never null
   * @return the underlying cause, never null
   */
  private static Throwable unwrap(final Throwable error) {
    if ((error instanceof CompletionException
        || error instanceof ExecutionException) && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }
}
