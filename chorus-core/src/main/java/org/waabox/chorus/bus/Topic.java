package org.waabox.chorus.bus;

import java.util.Objects;

/**
 * The closed set of event names published on the {@link EventBus}.
 *
 * <p>There are four families of topics:
 * <ul>
 *   <li>{@link Kind#RESOURCE_CHANGED}: one topic per resource, wire name
 *       {@code "<resource>Changed"} (e.g. {@code "membersChanged"}).</li>
 *   <li>{@link #DATA_CHANGED}: {@code "dataChanged"}, published for every
 *       change of any resource.</li>
 *   <li>{@link #FORCE_REFRESH}: {@code "forceRefresh"}, asks every consumer
 *       to re-fetch.</li>
 *   <li>{@link #ADMIN_ACTION_COMPLETED}: {@code "adminActionCompleted"},
 *       published after a local write.</li>
 * </ul>
 *
 * <p>Topics are values: two topics of the same kind and resource are equal.
 *
 * @param kind     the topic family, never null
 * @param resource the resource name for {@link Kind#RESOURCE_CHANGED},
 *                 null for every other kind
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Topic(Kind kind, String resource) {

  /** Suffix of the per-resource wire name. */
  private static final String CHANGED_SUFFIX = "Changed";

  /** Any resource changed. */
  public static final Topic DATA_CHANGED = new Topic(Kind.DATA_CHANGED, null);

  /** Every consumer should re-fetch now. */
  public static final Topic FORCE_REFRESH =
      new Topic(Kind.FORCE_REFRESH, null);

  /** A local write completed. */
  public static final Topic ADMIN_ACTION_COMPLETED =
      new Topic(Kind.ADMIN_ACTION_COMPLETED, null);

  /** The topic families. */
  public enum Kind {

    /** A specific resource changed. */
    RESOURCE_CHANGED,

    /** Any resource changed. */
    DATA_CHANGED,

    /** Consumers should re-fetch. */
    FORCE_REFRESH,

    /** A local write completed. */
    ADMIN_ACTION_COMPLETED
  }

  /**
   * Validates the kind and resource combination.
   *
   * @param kind     the topic family, never null
   * @param resource the resource, required only for resource topics
   */
  public Topic {
    Objects.requireNonNull(kind, "kind must not be null");
    if (kind == Kind.RESOURCE_CHANGED) {
      Objects.requireNonNull(resource, "resource must not be null");
      if (resource.isBlank()) {
        throw new IllegalArgumentException("resource must not be blank");
      }
    } else if (resource != null) {
      throw new IllegalArgumentException(
          "Only RESOURCE_CHANGED topics carry a resource, got: " + kind);
    }
  }

  /**
   * Returns the topic published when the given resource changes.
   *
   * @param resource the resource name, never null or blank
   * @return the resource topic, never null
   */
  public static Topic changed(final String resource) {
    return new Topic(Kind.RESOURCE_CHANGED, resource);
  }

  /**
   * Parses a wire name such as {@code "eventsChanged"} or
   * {@code "forceRefresh"}.
   *
   * @param wireName the wire name, never null
   * @return the topic, never null
   *
   * @throws IllegalArgumentException if the name is not a known topic
   */
  static Topic fromWireName(final String wireName) {
    Objects.requireNonNull(wireName, "wireName must not be null");
    switch (wireName) {
      case "dataChanged":
        return DATA_CHANGED;
      case "forceRefresh":
        return FORCE_REFRESH;
      case "adminActionCompleted":
        return ADMIN_ACTION_COMPLETED;
      default:
        break;
    }
    if (wireName.endsWith(CHANGED_SUFFIX)
        && wireName.length() > CHANGED_SUFFIX.length()) {
      return changed(wireName.substring(0,
          wireName.length() - CHANGED_SUFFIX.length()));
    }
    throw new IllegalArgumentException("Unknown topic: " + wireName);
  }

  /**
   * Returns the event name used on the wire and in logs.
   *
   * @return the wire name, never null
   */
  public String wireName() {
    switch (kind) {
      case RESOURCE_CHANGED:
        return resource + CHANGED_SUFFIX;
      case DATA_CHANGED:
        return "dataChanged";
      case FORCE_REFRESH:
        return "forceRefresh";
      default:
        return "adminActionCompleted";
    }
  }

  @Override
  public String toString() {
    return wireName();
  }
}
