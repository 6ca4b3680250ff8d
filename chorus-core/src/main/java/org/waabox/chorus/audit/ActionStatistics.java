package org.waabox.chorus.audit;

import java.util.Map;

/**
 * Aggregated counts over the records held by an {@link AdminActionLog}.
 *
 * @param total      the number of records
 * @param critical   the number of critical records
 * @param byAction   record counts keyed by action, never null
 * @param byResource record counts keyed by resource, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ActionStatistics(
    int total,
    int critical,
    Map<String, Long> byAction,
    Map<String, Long> byResource
) {

  /**
   * Copies the maps.
   *
   * @param total      the number of records
   * @param critical   the number of critical records
   * @param byAction   counts by action, never null
   * @param byResource counts by resource, never null
   */
  public ActionStatistics {
    byAction = Map.copyOf(byAction);
    byResource = Map.copyOf(byResource);
  }
}
