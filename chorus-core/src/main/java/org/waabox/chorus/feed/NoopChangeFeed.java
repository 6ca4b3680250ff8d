package org.waabox.chorus.feed;

import java.util.Objects;

/**
 * A {@link ChangeFeed} that never delivers changes.
 *
 * <p>Used when no backend feed is configured: subscriptions become active
 * immediately and only local writes drive notifications.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NoopChangeFeed implements ChangeFeed {

  /** {@inheritDoc} */
  @Override
  public ChangeFeedHandle open(final String resource,
      final ChangeFeedListener listener) {
    Objects.requireNonNull(resource, "resource must not be null");
    Objects.requireNonNull(listener, "listener must not be null");
    return new SilentHandle(resource);
  }

  /** {@inheritDoc} */
  @Override
  public void close(final ChangeFeedHandle handle) {
    Objects.requireNonNull(handle, "handle must not be null");
    if (handle instanceof SilentHandle) {
      ((SilentHandle) handle).open = false;
    }
  }

  /** A handle that only tracks whether it was closed. */
  private static final class SilentHandle implements ChangeFeedHandle {

    /** The subscribed resource. */
    private final String resource;

    /** Whether the handle is still open. */
    private volatile boolean open = true;

    /** Creates a new handle.
     *
     * @param theResource the resource, never null
     */
    private SilentHandle(final String theResource) {
      resource = theResource;
    }

    @Override
    public String resource() {
      return resource;
    }

    @Override
    public boolean isOpen() {
      return open;
    }
  }
}
