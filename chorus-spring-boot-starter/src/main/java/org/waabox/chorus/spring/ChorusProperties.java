package org.waabox.chorus.spring;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.waabox.chorus.BackoffPolicy;
import org.waabox.chorus.Chorus;
import org.waabox.chorus.audit.AdminActionLog;

/**
 * Configuration properties for Chorus, mapped from the {@code chorus.*}
 * prefix in application.yml or application.properties.
 *
 * <p>Supported keys:
 * <ul>
 *   <li>{@code chorus.resources} - the resources to subscribe to.</li>
 *   <li>{@code chorus.settle-delay} - the delay between a local write and
 *       the follow-up forceRefresh, 500ms by default.</li>
 *   <li>{@code chorus.health-check-interval} - the period of the health
 *       probe, 30s by default.</li>
 *   <li>{@code chorus.feed-backoff.*} and {@code chorus.refresh-backoff.*}
 *       - {@code base-delay}, {@code multiplier} and
 *       {@code max-attempts} of the reconnect and refresh retry
 *       policies.</li>
 *   <li>{@code chorus.action-log-capacity} - how many local writes the
 *       action log keeps.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "chorus")
public class ChorusProperties {

  /** The resources to subscribe to. */
  private List<String> resources = new ArrayList<>();

  /** The delay before the follow-up forceRefresh. */
  private Duration settleDelay = Chorus.DEFAULT_SETTLE_DELAY;

  /** The period of the health probe. */
  private Duration healthCheckInterval =
      Chorus.DEFAULT_HEALTH_CHECK_INTERVAL;

  /** The reconnect policy of the subscriptions. */
  private Backoff feedBackoff = new Backoff();

  /** The retry policy of the coordinators. */
  private Backoff refreshBackoff = new Backoff();

  /** The capacity of the action log. */
  private int actionLogCapacity = AdminActionLog.DEFAULT_CAPACITY;

  /**
   * Returns the resources to subscribe to.
   *
   * @return the resources, never null
   */
  public List<String> getResources() {
    return resources;
  }

  /**
   * Sets the resources to subscribe to.
   *
   * @param resources the resources, never null
   */
  public void setResources(final List<String> resources) {
    this.resources = resources;
  }

  /**
   * Returns the delay before the follow-up forceRefresh.
   *
   * @return the delay, never null
   */
  public Duration getSettleDelay() {
    return settleDelay;
  }

  /**
   * Sets the delay before the follow-up forceRefresh.
   *
   * @param settleDelay the delay, never null
   */
  public void setSettleDelay(final Duration settleDelay) {
    this.settleDelay = settleDelay;
  }

  /**
   * Returns the period of the health probe.
   *
   * @return the period, never null
   */
  public Duration getHealthCheckInterval() {
    return healthCheckInterval;
  }

  /**
   * Sets the period of the health probe.
   *
   * @param healthCheckInterval the period, never null
   */
  public void setHealthCheckInterval(final Duration healthCheckInterval) {
    this.healthCheckInterval = healthCheckInterval;
  }

  /**
   * Returns the reconnect policy settings.
   *
   * @return the settings, never null
   */
  public Backoff getFeedBackoff() {
    return feedBackoff;
  }

  /**
   * Sets the reconnect policy settings.
   *
   * @param feedBackoff the settings, never null
   */
  public void setFeedBackoff(final Backoff feedBackoff) {
    this.feedBackoff = feedBackoff;
  }

  /**
   * Returns the refresh retry policy settings.
   *
   * @return the settings, never null
   */
  public Backoff getRefreshBackoff() {
    return refreshBackoff;
  }

  /**
   * Sets the refresh retry policy settings.
   *
   * @param refreshBackoff the settings, never null
   */
  public void setRefreshBackoff(final Backoff refreshBackoff) {
    this.refreshBackoff = refreshBackoff;
  }

  /**
   * Returns the capacity of the action log.
   *
   * @return the capacity
   */
  public int getActionLogCapacity() {
    return actionLogCapacity;
  }

  /**
   * Sets the capacity of the action log.
   *
   * @param actionLogCapacity the capacity, greater than zero
   */
  public void setActionLogCapacity(final int actionLogCapacity) {
    this.actionLogCapacity = actionLogCapacity;
  }

  /** The settings of one {@link BackoffPolicy}. */
  public static class Backoff {

    /** The delay before the first retry. */
    private Duration baseDelay = Duration.ofSeconds(1);

    /** The growth factor of the delay. */
    private double multiplier = 2.0;

    /** The maximum number of consecutive attempts. */
    private int maxAttempts = 3;

    public Duration getBaseDelay() {
      return baseDelay;
    }

    public void setBaseDelay(final Duration baseDelay) {
      this.baseDelay = baseDelay;
    }

    public double getMultiplier() {
      return multiplier;
    }

    public void setMultiplier(final double multiplier) {
      this.multiplier = multiplier;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(final int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    /**
     * Creates the policy described by these settings.
     *
     * @return the policy, never null
     * @throws IllegalArgumentException if a value is out of range
     */
    public BackoffPolicy toPolicy() {
      return BackoffPolicy.of(baseDelay, multiplier, maxAttempts);
    }
  }
}
