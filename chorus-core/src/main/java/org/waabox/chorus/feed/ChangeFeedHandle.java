package org.waabox.chorus.feed;

/**
 * An open subscription to one resource's change-feed, created by
 * {@link ChangeFeed#open}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ChangeFeedHandle {

  /**
   * Returns the subscribed resource.
   *
   * @return the resource name, never null
   */
  String resource();

  /**
   * Tells whether the handle still delivers changes.
   *
   * @return false once the handle was closed or failed
   */
  boolean isOpen();
}
