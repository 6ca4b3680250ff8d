package org.waabox.chorus.health;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A {@link HealthGate} whose state is written by a health checker.
 *
 * <p>Starts healthy.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MutableHealthGate implements HealthGate {

  /** The latest known health. */
  private final AtomicBoolean healthy = new AtomicBoolean(true);

  /** {@inheritDoc} */
  @Override
  public boolean isHealthy() {
    return healthy.get();
  }

  /**
   * Records a new health state.
   *
   * @param isHealthy the new state
   * @return the previous state
   */
  public boolean update(final boolean isHealthy) {
    return healthy.getAndSet(isHealthy);
  }
}
