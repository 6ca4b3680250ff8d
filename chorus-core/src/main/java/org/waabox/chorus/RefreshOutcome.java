package org.waabox.chorus;

/**
 * How a refresh trigger ended.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum RefreshOutcome {

  /** The refresh operation succeeded, possibly after retries. */
  SUCCEEDED,

  /** Every allowed attempt failed. Previously loaded data is kept. */
  FAILED,

  /** Dropped because another refresh of the same coordinator was running. */
  SKIPPED_BUSY,

  /** Dropped because the coordinator is paused. */
  SKIPPED_PAUSED,

  /** A periodic trigger dropped because the backend is unhealthy. */
  SKIPPED_UNHEALTHY,

  /** The coordinator was disposed. */
  DISPOSED
}
