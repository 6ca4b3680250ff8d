package org.waabox.chorus.feed;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A raw change delivered by a {@link ChangeFeed}.
 *
 * @param resource   the resource that changed, never null
 * @param action     the change kind reported by the backend (e.g.
 *                   {@code insert}, {@code update}, {@code delete}),
 *                   never null
 * @param version    a monotonically increasing version for the resource,
 *                   or 0 when the backend does not track one
 * @param occurredAt when the change happened, never null
 * @param attributes backend specific attributes, never null, immutable
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ChangePayload(
    String resource,
    String action,
    long version,
    Instant occurredAt,
    Map<String, String> attributes
) {

  /**
   * Validates and copies the fields.
   *
   * @param resource   the resource, never null
   * @param action     the action, never null
   * @param version    the version
   * @param occurredAt the instant, never null
   * @param attributes the attributes, never null
   */
  public ChangePayload {
    Objects.requireNonNull(resource, "resource must not be null");
    Objects.requireNonNull(action, "action must not be null");
    Objects.requireNonNull(occurredAt, "occurredAt must not be null");
    attributes = Map.copyOf(Objects.requireNonNull(attributes,
        "attributes must not be null"));
  }

  /**
   * Creates a payload without attributes.
   *
   * @param resource   the resource, never null
   * @param action     the action, never null
   * @param version    the version
   * @param occurredAt the instant, never null
   * @return a new payload, never null
   */
  public static ChangePayload of(final String resource, final String action,
      final long version, final Instant occurredAt) {
    return new ChangePayload(resource, action, version, occurredAt, Map.of());
  }
}
