package org.waabox.chorus;

import java.time.Duration;
import java.util.Objects;

/**
 * Defines how failed operations are retried: how many consecutive attempts
 * are allowed and how long to wait between them.
 *
 * <p>The wait before the retry that follows the n-th consecutive failure is
 * {@code baseDelay * multiplier^(n - 1)}. With the default policy (1 second
 * base delay, multiplier 2, 3 attempts) the waits are 1 second and then
 * 2 seconds, and the third consecutive failure is final.
 *
 * <p>The same policy type drives both change-feed reconnects and refresh
 * retries.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class BackoffPolicy {

  /** The default number of attempts. */
  private static final int DEFAULT_MAX_ATTEMPTS = 3;

  /** The default base delay. */
  private static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);

  /** The default multiplier. */
  private static final double DEFAULT_MULTIPLIER = 2.0;

  /** The delay before the first retry. */
  private final Duration baseDelay;

  /** The factor applied to the delay after each failure. */
  private final double multiplier;

  /** The maximum number of consecutive attempts. */
  private final int maxAttempts;

  /**
   * Creates a new backoff policy.
   *
   * @param baseDelay   the delay before the first retry, never null
   * @param multiplier  the growth factor, at least 1
   * @param maxAttempts the maximum number of attempts, greater than zero
   */
  private BackoffPolicy(final Duration baseDelay, final double multiplier,
      final int maxAttempts) {
    this.baseDelay = baseDelay;
    this.multiplier = multiplier;
    this.maxAttempts = maxAttempts;
  }

  /**
   * Creates a backoff policy with the given parameters.
   *
   * @param baseDelay   the delay before the first retry, never null and
   *                    not negative
   * @param multiplier  the growth factor applied after each failure, must
   *                    be at least 1
   * @param maxAttempts the maximum number of consecutive attempts, must be
   *                    greater than zero
   * @return a new backoff policy, never null
   *
   * @throws NullPointerException     if baseDelay is null
   * @throws IllegalArgumentException if any value is out of range
   */
  public static BackoffPolicy of(final Duration baseDelay,
      final double multiplier, final int maxAttempts) {
    Objects.requireNonNull(baseDelay, "baseDelay must not be null");
    if (baseDelay.isNegative()) {
      throw new IllegalArgumentException(
          "baseDelay must not be negative, got: " + baseDelay);
    }
    if (Double.isNaN(multiplier) || multiplier < 1.0) {
      throw new IllegalArgumentException(
          "multiplier must be at least 1, got: " + multiplier);
    }
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException(
          "maxAttempts must be greater than 0, got: " + maxAttempts);
    }
    return new BackoffPolicy(baseDelay, multiplier, maxAttempts);
  }

  /**
   * Creates the default policy: 1 second base delay, doubling, 3 attempts.
   *
   * @return the default backoff policy, never null
   */
  public static BackoffPolicy defaultPolicy() {
    return new BackoffPolicy(DEFAULT_BASE_DELAY, DEFAULT_MULTIPLIER,
        DEFAULT_MAX_ATTEMPTS);
  }

  /**
   * Tells whether another attempt is allowed after the given number of
   * consecutive failures.
   *
   * @param failures the consecutive failures so far, at least 1
   * @return true if a retry should be scheduled
   */
  public boolean allowsRetry(final int failures) {
    return failures < maxAttempts;
  }

  /**
   * Computes the wait before the retry that follows the given number of
   * consecutive failures.
   *
   * @param failures the consecutive failures so far, at least 1
   * @return the delay, never null
   *
   * @throws IllegalArgumentException if failures is less than 1
   */
  public Duration delayBeforeRetry(final int failures) {
    if (failures < 1) {
      throw new IllegalArgumentException(
          "failures must be at least 1, got: " + failures);
    }
    final double factor = Math.pow(multiplier, failures - 1);
    return Duration.ofMillis(Math.round(baseDelay.toMillis() * factor));
  }

  /**
   * Returns the delay before the first retry.
   *
   * @return the base delay, never null
   */
  public Duration baseDelay() {
    return baseDelay;
  }

  /**
   * Returns the growth factor applied after each failure.
   *
   * @return the multiplier, at least 1
   */
  public double multiplier() {
    return multiplier;
  }

  /**
   * Returns the maximum number of consecutive attempts.
   *
   * @return the maximum attempts, always greater than zero
   */
  public int maxAttempts() {
    return maxAttempts;
  }

  @Override
  public String toString() {
    return "BackoffPolicy{baseDelay=" + baseDelay + ", multiplier="
        + multiplier + ", maxAttempts=" + maxAttempts + "}";
  }
}
