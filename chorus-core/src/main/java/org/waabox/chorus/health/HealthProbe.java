package org.waabox.chorus.health;

/**
 * Checks whether the backend is reachable. May perform I/O.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface HealthProbe {

  /**
   * Probes the backend.
   *
   * @return true if the backend answered
   *
   * @throws Exception if the probe itself failed, which counts as unhealthy
   */
  boolean probe() throws Exception;
}
