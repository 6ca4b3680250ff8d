package org.waabox.chorus.health;

/**
 * A cheap read of whether the backend is currently reachable.
 *
 * <p>Refresh coordinators consult the gate before a periodic refresh so a
 * degraded backend is not hammered. The gate is only read, never computed:
 * implementations must not block or perform I/O in {@link #isHealthy()}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface HealthGate {

  /**
   * Returns the latest known health state.
   *
   * @return true if the backend was reachable at the last check
   */
  boolean isHealthy();

  /**
   * Returns a gate that always reports healthy, for setups without a
   * health probe.
   *
   * @return the gate, never null
   */
  static HealthGate alwaysHealthy() {
    return () -> true;
  }
}
