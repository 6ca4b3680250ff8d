package org.waabox.chorus.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One local write recorded by the {@link AdminActionLog}.
 *
 * @param resource   the written resource, never null
 * @param action     the write action or reason, never null
 * @param recordedAt when the write was notified, never null
 * @param payload    extra attributes, never null, immutable
 * @param critical   whether the action is destructive (deletes, bulk
 *                   operations)
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record AdminActionRecord(
    String resource,
    String action,
    Instant recordedAt,
    Map<String, String> payload,
    boolean critical
) {

  /**
   * Validates and copies the fields.
   *
   * @param resource   the resource, never null
   * @param action     the action, never null
   * @param recordedAt the instant, never null
   * @param payload    the attributes, never null
   * @param critical   whether the action is destructive
   */
  public AdminActionRecord {
    Objects.requireNonNull(resource, "resource must not be null");
    Objects.requireNonNull(action, "action must not be null");
    Objects.requireNonNull(recordedAt, "recordedAt must not be null");
    payload = Map.copyOf(Objects.requireNonNull(payload,
        "payload must not be null"));
  }
}
