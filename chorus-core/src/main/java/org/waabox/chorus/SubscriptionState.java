package org.waabox.chorus;

/**
 * Lifecycle state of a {@link ChangeFeedSubscription}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum SubscriptionState {

  /** Not subscribed: never opened, or closed. */
  IDLE,

  /** A connect attempt is in progress. */
  CONNECTING,

  /** The handle is live and delivering changes. */
  ACTIVE,

  /** The last attempt failed; a retry may be pending. */
  FAILED
}
