package org.waabox.chorus.feed;

/**
 * Signals that a change-feed subscription could not be established.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ChangeFeedException extends Exception {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public ChangeFeedException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public ChangeFeedException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
