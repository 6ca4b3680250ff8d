package org.waabox.chorus.bus;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Describes the change behind a bus publication.
 *
 * @param resource   the resource that changed, never null
 * @param action     what happened, e.g. {@code insert}, {@code update},
 *                   {@code delete}, or a free-form reason, never null
 * @param origin     where the change was observed, never null
 * @param occurredAt when the change happened, never null
 * @param payload    extra attributes, never null, immutable
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ChangeNotice(
    String resource,
    String action,
    Origin origin,
    Instant occurredAt,
    Map<String, String> payload
) {

  /** Where a change was observed. */
  public enum Origin {

    /** Delivered by the backend change-feed. */
    FEED,

    /** Synthesized after a successful local write. */
    LOCAL_WRITE
  }

  /**
   * Validates and copies the fields.
   *
   * @param resource   the resource, never null
   * @param action     the action, never null
   * @param origin     the origin, never null
   * @param occurredAt the instant, never null
   * @param payload    the attributes, never null
   */
  public ChangeNotice {
    Objects.requireNonNull(resource, "resource must not be null");
    Objects.requireNonNull(action, "action must not be null");
    Objects.requireNonNull(origin, "origin must not be null");
    Objects.requireNonNull(occurredAt, "occurredAt must not be null");
    payload = Map.copyOf(Objects.requireNonNull(payload,
        "payload must not be null"));
  }

  /**
   * Creates a notice for a local write.
   *
   * @param resource   the written resource, never null
   * @param action     the write action or reason, never null
   * @param occurredAt when the write completed, never null
   * @param payload    extra attributes, never null
   * @return a new notice, never null
   */
  public static ChangeNotice localWrite(final String resource,
      final String action, final Instant occurredAt,
      final Map<String, String> payload) {
    return new ChangeNotice(resource, action, Origin.LOCAL_WRITE,
        occurredAt, payload);
  }
}
