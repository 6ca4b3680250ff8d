package org.waabox.chorus;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A point-in-time view of the synchronization layer.
 *
 * @param active        true once started and until shut down
 * @param lastSyncAt    the last change seen from any feed or local write,
 *                      null if none yet
 * @param listenerCount the number of registrations on the event bus
 * @param subscriptions the state of every subscription, in start order,
 *                      never null, immutable
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SyncStatus(
    boolean active,
    Instant lastSyncAt,
    int listenerCount,
    Map<String, SubscriptionState> subscriptions
) {

  /**
   * Validates the fields.
   *
   * @param active        whether the layer is running
   * @param lastSyncAt    the last change instant, may be null
   * @param listenerCount the listener count
   * @param subscriptions the subscription states, never null
   */
  public SyncStatus {
    Objects.requireNonNull(subscriptions, "subscriptions must not be null");
  }

  /**
   * Tells whether every subscription is live.
   *
   * @return true if all subscriptions are {@link SubscriptionState#ACTIVE}
   */
  public boolean isFullyConnected() {
    return subscriptions.values().stream()
        .allMatch(state -> state == SubscriptionState.ACTIVE);
  }
}
