package org.waabox.chorus.feed;

/**
 * Receives the asynchronous output of one {@link ChangeFeedHandle}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ChangeFeedListener {

  /**
   * Called when the subscribed resource changed.
   *
   * @param payload the change, never null
   */
  void onChange(ChangePayload payload);

  /**
   * Called when the handle broke after it was opened. No further changes
   * are delivered through it.
   *
   * @param cause the failure, never null
   */
  void onFailure(Throwable cause);
}
