package org.waabox.chorus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link BackoffPolicy}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class BackoffPolicyTest {

  @Test
  void whenCreating_givenValidParams_shouldRetainValues() {
    final BackoffPolicy policy = BackoffPolicy.of(Duration.ofMillis(250),
        3.0, 5);

    assertEquals(Duration.ofMillis(250), policy.baseDelay());
    assertEquals(3.0, policy.multiplier());
    assertEquals(5, policy.maxAttempts());
  }

  @Test
  void whenUsingDefault_shouldWaitOneThenTwoSecondsAndStopAtThree() {
    final BackoffPolicy policy = BackoffPolicy.defaultPolicy();

    assertEquals(Duration.ofSeconds(1), policy.delayBeforeRetry(1));
    assertEquals(Duration.ofSeconds(2), policy.delayBeforeRetry(2));
    assertTrue(policy.allowsRetry(1));
    assertTrue(policy.allowsRetry(2));
    assertFalse(policy.allowsRetry(3));
  }

  @Test
  void whenComputingDelay_givenFixedMultiplier_shouldNotGrow() {
    final BackoffPolicy policy = BackoffPolicy.of(Duration.ofMillis(100),
        1.0, 10);

    assertEquals(Duration.ofMillis(100), policy.delayBeforeRetry(1));
    assertEquals(Duration.ofMillis(100), policy.delayBeforeRetry(7));
  }

  @Test
  void whenComputingDelay_givenZeroFailures_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        BackoffPolicy.defaultPolicy().delayBeforeRetry(0)
    );
  }

  @Test
  void whenCreating_givenSingleAttempt_shouldNeverRetry() {
    final BackoffPolicy policy = BackoffPolicy.of(Duration.ofSeconds(1),
        2.0, 1);

    assertFalse(policy.allowsRetry(1));
  }

  @Test
  void whenCreating_givenZeroAttempts_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        BackoffPolicy.of(Duration.ofSeconds(1), 2.0, 0)
    );
  }

  @Test
  void whenCreating_givenNullBaseDelay_shouldThrow() {
    assertThrows(NullPointerException.class, () ->
        BackoffPolicy.of(null, 2.0, 3)
    );
  }

  @Test
  void whenCreating_givenNegativeBaseDelay_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        BackoffPolicy.of(Duration.ofSeconds(-1), 2.0, 3)
    );
  }

  @Test
  void whenCreating_givenShrinkingMultiplier_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        BackoffPolicy.of(Duration.ofSeconds(1), 0.5, 3)
    );
  }
}
