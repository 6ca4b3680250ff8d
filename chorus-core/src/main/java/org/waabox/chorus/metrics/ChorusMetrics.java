package org.waabox.chorus.metrics;

import org.waabox.chorus.RefreshOutcome;
import org.waabox.chorus.SubscriptionState;

/**
 * An abstraction for recording operational metrics of the synchronization
 * layer.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer, Prometheus, or Datadog. Use {@link NoopChorusMetrics}
 * when metrics collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ChorusMetrics {

  /**
   * Records a successful refresh.
   *
   * @param ownerLabel the diagnostic name of the coordinator, never null
   * @param attempts   the number of attempts it took, at least 1
   */
  void refreshSucceeded(String ownerLabel, int attempts);

  /**
   * Records a refresh that failed after exhausting its retries.
   *
   * @param ownerLabel the diagnostic name of the coordinator, never null
   * @param cause      the last failure, never null
   */
  void refreshFailed(String ownerLabel, Throwable cause);

  /**
   * Records a trigger that did not run the refresh operation.
   *
   * @param ownerLabel the diagnostic name of the coordinator, never null
   * @param outcome    why it was skipped, never null
   */
  void refreshSkipped(String ownerLabel, RefreshOutcome outcome);

  /**
   * Records a change-feed subscription state transition.
   *
   * @param resource the subscribed resource, never null
   * @param state    the new state, never null
   */
  void subscriptionStateChanged(String resource, SubscriptionState state);

  /**
   * Records a bus listener that threw.
   *
   * @param topic the wire name of the topic, never null
   * @param cause the exception thrown by the listener, never null
   */
  void listenerFailed(String topic, Throwable cause);
}
