package org.waabox.chorus.metrics;

import org.waabox.chorus.RefreshOutcome;
import org.waabox.chorus.SubscriptionState;

/**
 * A no-operation implementation of {@link ChorusMetrics}.
 *
 * <p>All methods in this class are intentionally empty. Use this
 * implementation when metrics collection is not required or during
 * testing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopChorusMetrics implements ChorusMetrics {

  /** {@inheritDoc} */
  @Override
  public void refreshSucceeded(final String ownerLabel, final int attempts) {
  }

  /** {@inheritDoc} */
  @Override
  public void refreshFailed(final String ownerLabel, final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void refreshSkipped(final String ownerLabel,
      final RefreshOutcome outcome) {
  }

  /** {@inheritDoc} */
  @Override
  public void subscriptionStateChanged(final String resource,
      final SubscriptionState state) {
  }

  /** {@inheritDoc} */
  @Override
  public void listenerFailed(final String topic, final Throwable cause) {
  }
}
