package org.waabox.chorus.feed;

/**
 * The backend primitive for subscribing to a resource's change-feed.
 *
 * <p>Implementations define how changes are observed (e.g. database
 * polling, a Kafka topic) and own the transport. Each call to
 * {@link #open} yields an independent handle; the caller owns it and must
 * release it through {@link #close}.
 *
 * <p>Typical lifecycle:
 * <ol>
 *   <li>{@link #open(String, ChangeFeedListener)} once per resource</li>
 *   <li>Receive {@link ChangeFeedListener#onChange} callbacks</li>
 *   <li>{@link #close(ChangeFeedHandle)} on failure or teardown</li>
 *   <li>{@link #shutdown()} when the process stops</li>
 * </ol>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ChangeFeed {

  /**
   * Opens a subscription to one resource's changes.
   *
   * <p>This call may block while the connection is established.
   *
   * @param resource the resource to subscribe to, never null
   * @param listener receives changes and asynchronous failures of the
   *                 returned handle, never null
   * @return the live handle, never null
   *
   * @throws ChangeFeedException if the subscription cannot be established
   */
  ChangeFeedHandle open(String resource, ChangeFeedListener listener)
      throws ChangeFeedException;

  /**
   * Releases a handle. After this call the handle's listener receives no
   * further callbacks. Closing a handle twice has no effect.
   *
   * @param handle the handle to release, never null
   */
  void close(ChangeFeedHandle handle);

  /**
   * Releases the transport shared by all handles.
   *
   * <p>The default implementation does nothing.
   */
  default void shutdown() {
  }
}
