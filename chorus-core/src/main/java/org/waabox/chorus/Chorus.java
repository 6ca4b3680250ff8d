package org.waabox.chorus;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.chorus.audit.AdminActionLog;
import org.waabox.chorus.bus.EventBus;
import org.waabox.chorus.bus.Topic;
import org.waabox.chorus.feed.ChangeFeed;
import org.waabox.chorus.feed.NoopChangeFeed;
import org.waabox.chorus.health.HealthGate;
import org.waabox.chorus.health.HealthMonitor;
import org.waabox.chorus.health.HealthProbe;
import org.waabox.chorus.health.MutableHealthGate;
import org.waabox.chorus.metrics.ChorusMetrics;
import org.waabox.chorus.metrics.NoopChorusMetrics;
import org.waabox.chorus.schedule.ExecutorTaskScheduler;
import org.waabox.chorus.schedule.TaskScheduler;

/**
 * Main entry point of the synchronization layer.
 *
 * <p>Chorus wires the {@link EventBus}, the {@link SubscriptionRegistry},
 * the health monitoring and the {@link RefreshCoordinator}s of every
 * consumer. Build one instance per process with {@link #builder()}, call
 * {@link #start()}, and {@link #shutdown()} when the process stops.
 *
 * <p>Usage example:
 * <pre>{@code
 * Chorus chorus = Chorus.builder()
 *     .changeFeed(feed)
 *     .resources("members", "events", "donations")
 *     .healthProbe(() -> pingBackend())
 *     .build();
 *
 * chorus.start();
 *
 * RefreshCoordinator members = chorus.createRefreshCoordinator(
 *     RefreshOperation.blocking(memberService::reload, executor),
 *     Duration.ofMinutes(5), "members");
 *
 * chorus.notifyWrite("members", "create");
 *
 * members.dispose();
 * chorus.shutdown();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Chorus {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(Chorus.class);

  /** The refresh interval used when none is given. */
  public static final Duration DEFAULT_REFRESH_INTERVAL =
      Duration.ofMinutes(5);

  /** The default delay between a local write and the forceRefresh. */
  public static final Duration DEFAULT_SETTLE_DELAY = Duration.ofMillis(500);

  /** The default period of the health probe. */
  public static final Duration DEFAULT_HEALTH_CHECK_INTERVAL =
      Duration.ofSeconds(30);

  /** The action of a write notified without a reason. */
  private static final String DEFAULT_WRITE_REASON = "write";

  /** The resources subscribed on start, never null. */
  private final Set<String> resources;

  /** The scheduler, never null. */
  private final TaskScheduler scheduler;

  /** Whether the scheduler was created here and must be shut down here. */
  private final boolean ownsScheduler;

  /** The bus, never null. */
  private final EventBus eventBus;

  /** The gate read by periodic refreshes, never null. */
  private final HealthGate healthGate;

  /** The monitor feeding the gate, null without a probe. */
  private final HealthMonitor healthMonitor;

  /** The subscription registry, never null. */
  private final SubscriptionRegistry registry;

  /** The local write log, never null. */
  private final AdminActionLog actionLog;

  /** The retry policy of every coordinator, never null. */
  private final BackoffPolicy refreshBackoff;

  /** The metrics reporter, never null. */
  private final ChorusMetrics metrics;

  /** The coordinators not yet disposed. */
  private final Set<RefreshCoordinator> coordinators =
      new CopyOnWriteArraySet<>();

  /** Numbers the labels of coordinators created without a resource. */
  private final AtomicInteger anonymousCount = new AtomicInteger(0);

  /** Whether start was called. */
  private final AtomicBoolean started = new AtomicBoolean(false);

  /** Whether shutdown was called. */
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  /**
   * Creates a new instance from the builder.
   *
   * @param builder the builder, never null
   */
  private Chorus(final Builder builder) {
    resources = Collections.unmodifiableSet(
        new LinkedHashSet<>(builder.resources));
    metrics = builder.metrics;
    ownsScheduler = builder.scheduler == null;
    scheduler = ownsScheduler
        ? ExecutorTaskScheduler.create() : builder.scheduler;
    eventBus = new EventBus(metrics);
    actionLog = new AdminActionLog(builder.actionLogCapacity);
    refreshBackoff = builder.refreshBackoff;

    if (builder.healthProbe != null) {
      final MutableHealthGate gate = new MutableHealthGate();
      healthGate = gate;
      healthMonitor = new HealthMonitor(builder.healthProbe, gate, scheduler,
          builder.healthCheckInterval);
    } else {
      healthGate = HealthGate.alwaysHealthy();
      healthMonitor = null;
    }

    registry = new SubscriptionRegistry(builder.changeFeed, eventBus,
        scheduler, builder.feedBackoff, builder.settleDelay, actionLog,
        metrics);
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts health monitoring and opens the change-feed subscriptions.
   *
   * <p>Only the first call has an effect.
   */
  public void start() {
    if (stopped.get()) {
      log.warn("Chorus already shut down, ignoring start");
      return;
    }
    if (!started.compareAndSet(false, true)) {
      log.warn("Chorus already started, ignoring start");
      return;
    }
    if (healthMonitor != null) {
      healthMonitor.start();
    }
    registry.start(resources);
    log.info("Chorus started");
  }

  /**
   * Disposes every coordinator, closes the subscriptions and stops the
   * background threads. Idempotent.
   */
  public void shutdown() {
    if (!stopped.compareAndSet(false, true)) {
      log.debug("Chorus already shut down");
      return;
    }
    for (final RefreshCoordinator coordinator : coordinators) {
      coordinator.dispose();
    }
    coordinators.clear();

    registry.shutdown();

    if (healthMonitor != null) {
      healthMonitor.stop();
    }
    if (ownsScheduler) {
      scheduler.shutdown();
    }
    log.info("Chorus shut down");
  }

  /**
   * Creates a coordinator that only reacts to the generic topics, with the
   * default interval.
   *
   * @param operation the refresh code, never null
   * @return the running coordinator, never null
   */
  public RefreshCoordinator createRefreshCoordinator(
      final RefreshOperation operation) {
    return createRefreshCoordinator(operation, DEFAULT_REFRESH_INTERVAL,
        null);
  }

  /**
   * Creates a coordinator that only reacts to the generic topics.
   *
   * @param operation the refresh code, never null
   * @param interval  the period of the timer, must be positive
   * @return the running coordinator, never null
   */
  public RefreshCoordinator createRefreshCoordinator(
      final RefreshOperation operation, final Duration interval) {
    return createRefreshCoordinator(operation, interval, null);
  }

  /**
   * Creates a coordinator for one consumer.
   *
   * <p>The coordinator immediately runs an initial refresh. It must be
   * disposed when the consumer goes away; any coordinator still alive is
   * disposed on {@link #shutdown()}.
   *
   * @param operation the refresh code, never null
   * @param interval  the period of the timer, must be positive
   * @param resource  the watched resource, or null for generic topics only
   * @return the running coordinator, never null
   * @throws IllegalStateException if this instance was shut down
   */
  public RefreshCoordinator createRefreshCoordinator(
      final RefreshOperation operation, final Duration interval,
      final String resource) {
    if (stopped.get()) {
      throw new IllegalStateException("Chorus has been shut down");
    }
    final String label = resource != null
        ? resource : "component-" + anonymousCount.incrementAndGet();

    final RefreshCoordinator coordinator = RefreshCoordinator.create(label,
        operation, interval, resource, eventBus, scheduler, refreshBackoff,
        healthGate, metrics, coordinators::remove);
    if (!coordinator.isDisposed()) {
      coordinators.add(coordinator);
    }
    return coordinator;
  }

  /**
   * Announces a local write with the default reason.
   *
   * @param resource the resource written, never null
   */
  public void notifyWrite(final String resource) {
    notifyWrite(resource, DEFAULT_WRITE_REASON, Map.of());
  }

  /**
   * Announces a local write.
   *
   * @param resource the resource written, never null
   * @param reason   the action, never null
   */
  public void notifyWrite(final String resource, final String reason) {
    notifyWrite(resource, reason, Map.of());
  }

  /**
   * Announces a local write so every consumer refreshes.
   *
   * @param resource the resource written, never null
   * @param reason   the action, never null
   * @param payload  extra details kept in the action log, never null
   * @see SubscriptionRegistry#notifyExternal(String, String, Map)
   */
  public void notifyWrite(final String resource, final String reason,
      final Map<String, String> payload) {
    registry.notifyExternal(resource, reason, payload);
  }

  /** Publishes {@code "forceRefresh"} now. */
  public void forceRefreshAll() {
    if (stopped.get()) {
      log.warn("Chorus shut down, ignoring forceRefreshAll");
      return;
    }
    eventBus.publish(Topic.FORCE_REFRESH);
  }

  /**
   * Re-opens a subscription that gave up.
   *
   * @param resource the resource, never null
   * @return true if the resource is known
   */
  public boolean reopen(final String resource) {
    return registry.reopen(resource);
  }

  /**
   * Returns the bus, for consumers that subscribe directly.
   *
   * @return the bus, never null
   */
  public EventBus eventBus() {
    return eventBus;
  }

  /**
   * Returns the gate periodic refreshes consult.
   *
   * @return the gate, never null
   */
  public HealthGate healthGate() {
    return healthGate;
  }

  /**
   * Returns the state of every subscription.
   *
   * @return the states by resource, never null, immutable
   */
  public Map<String, SubscriptionState> status() {
    return registry.status();
  }

  /**
   * Returns an aggregate view of the layer.
   *
   * @return the status, never null
   */
  public SyncStatus syncStatus() {
    return registry.syncStatus();
  }

  /**
   * Returns the log of local writes.
   *
   * @return the log, never null
   */
  public AdminActionLog actionLog() {
    return actionLog;
  }

  /**
   * Returns the number of coordinators not yet disposed.
   *
   * @return the count
   */
  public int coordinatorCount() {
    return coordinators.size();
  }

  /**
   * Tells whether this instance is started and not shut down.
   *
   * @return true while running
   */
  public boolean isRunning() {
    return started.get() && !stopped.get();
  }

  /**
   * Builder for {@link Chorus}.
   *
   * <p>Every setting is optional. Without a change-feed, subscriptions use
   * a {@link NoopChangeFeed} and only local writes produce notifications.
   * Without a health probe, the backend is always considered healthy.
   */
  public static final class Builder {

    /** The backend feed. */
    private ChangeFeed changeFeed = new NoopChangeFeed();

    /** The resources to subscribe to. */
    private final Set<String> resources = new LinkedHashSet<>();

    /** The scheduler, null to create one. */
    private TaskScheduler scheduler;

    /** The health probe, null to skip monitoring. */
    private HealthProbe healthProbe;

    /** The period of the health probe. */
    private Duration healthCheckInterval = DEFAULT_HEALTH_CHECK_INTERVAL;

    /** The reconnect policy of the subscriptions. */
    private BackoffPolicy feedBackoff = BackoffPolicy.defaultPolicy();

    /** The retry policy of the coordinators. */
    private BackoffPolicy refreshBackoff = BackoffPolicy.defaultPolicy();

    /** The delay before the follow-up forceRefresh. */
    private Duration settleDelay = DEFAULT_SETTLE_DELAY;

    /** The metrics reporter. */
    private ChorusMetrics metrics = new NoopChorusMetrics();

    /** The capacity of the action log. */
    private int actionLogCapacity = AdminActionLog.DEFAULT_CAPACITY;

    /** Creates a new builder. */
    private Builder() {
    }

    /**
     * Sets the backend change-feed.
     *
     * @param theChangeFeed the feed, never null
     * @return this builder, never null
     */
    public Builder changeFeed(final ChangeFeed theChangeFeed) {
      changeFeed = Objects.requireNonNull(theChangeFeed,
          "changeFeed must not be null");
      return this;
    }

    /**
     * Adds resources to subscribe to on start.
     *
     * @param theResources the resource names, never null or blank
     * @return this builder, never null
     */
    public Builder resources(final String... theResources) {
      Objects.requireNonNull(theResources, "resources must not be null");
      for (final String resource : theResources) {
        resource(resource);
      }
      return this;
    }

    /**
     * Adds resources to subscribe to on start.
     *
     * @param theResources the resource names, never null or blank
     * @return this builder, never null
     */
    public Builder resources(final Iterable<String> theResources) {
      Objects.requireNonNull(theResources, "resources must not be null");
      for (final String resource : theResources) {
        resource(resource);
      }
      return this;
    }

    /**
     * Adds one resource to subscribe to on start.
     *
     * @param theResource the resource name, never null or blank
     * @return this builder, never null
     */
    public Builder resource(final String theResource) {
      Objects.requireNonNull(theResource, "resource must not be null");
      if (theResource.isBlank()) {
        throw new IllegalArgumentException("resource must not be blank");
      }
      resources.add(theResource);
      return this;
    }

    /**
     * Sets the scheduler. A scheduler given here is not shut down by
     * {@link Chorus#shutdown()}.
     *
     * @param theScheduler the scheduler, never null
     * @return this builder, never null
     */
    public Builder scheduler(final TaskScheduler theScheduler) {
      scheduler = Objects.requireNonNull(theScheduler,
          "scheduler must not be null");
      return this;
    }

    /**
     * Sets the probe that feeds the health gate.
     *
     * @param theHealthProbe the probe, never null
     * @return this builder, never null
     */
    public Builder healthProbe(final HealthProbe theHealthProbe) {
      healthProbe = Objects.requireNonNull(theHealthProbe,
          "healthProbe must not be null");
      return this;
    }

    /**
     * Sets the period of the health probe.
     *
     * @param theInterval the period, must be positive
     * @return this builder, never null
     */
    public Builder healthCheckInterval(final Duration theInterval) {
      Objects.requireNonNull(theInterval, "interval must not be null");
      if (theInterval.isZero() || theInterval.isNegative()) {
        throw new IllegalArgumentException(
            "healthCheckInterval must be positive, got: " + theInterval);
      }
      healthCheckInterval = theInterval;
      return this;
    }

    /**
     * Sets the reconnect policy of the subscriptions.
     *
     * @param theBackoff the policy, never null
     * @return this builder, never null
     */
    public Builder feedBackoff(final BackoffPolicy theBackoff) {
      feedBackoff = Objects.requireNonNull(theBackoff,
          "feedBackoff must not be null");
      return this;
    }

    /**
     * Sets the retry policy of the coordinators.
     *
     * @param theBackoff the policy, never null
     * @return this builder, never null
     */
    public Builder refreshBackoff(final BackoffPolicy theBackoff) {
      refreshBackoff = Objects.requireNonNull(theBackoff,
          "refreshBackoff must not be null");
      return this;
    }

    /**
     * Sets the delay between a local write and the forceRefresh.
     *
     * @param theSettleDelay the delay, never null nor negative
     * @return this builder, never null
     */
    public Builder settleDelay(final Duration theSettleDelay) {
      Objects.requireNonNull(theSettleDelay, "settleDelay must not be null");
      if (theSettleDelay.isNegative()) {
        throw new IllegalArgumentException(
            "settleDelay must not be negative, got: " + theSettleDelay);
      }
      settleDelay = theSettleDelay;
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * @param theMetrics the reporter, never null
     * @return this builder, never null
     */
    public Builder metrics(final ChorusMetrics theMetrics) {
      metrics = Objects.requireNonNull(theMetrics,
          "metrics must not be null");
      return this;
    }

    /**
     * Sets how many local writes the action log keeps.
     *
     * @param theCapacity the capacity, greater than zero
     * @return this builder, never null
     */
    public Builder actionLogCapacity(final int theCapacity) {
      if (theCapacity <= 0) {
        throw new IllegalArgumentException(
            "actionLogCapacity must be greater than 0, got: " + theCapacity);
      }
      actionLogCapacity = theCapacity;
      return this;
    }

    /**
     * Builds the instance. Nothing runs until {@link Chorus#start()}.
     *
     * @return a new instance, never null
     */
    public Chorus build() {
      return new Chorus(this);
    }
  }
}
