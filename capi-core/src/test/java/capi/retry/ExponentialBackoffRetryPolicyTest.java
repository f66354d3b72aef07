package capi.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void defaultScheduleDoublesFromFiveMinutes() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy();

    assertEquals(Duration.ofMinutes(5), policy.computeDelay(1));
    assertEquals(Duration.ofMinutes(10), policy.computeDelay(2));
    assertEquals(Duration.ofMinutes(20), policy.computeDelay(3));
    assertEquals(Duration.ofMinutes(40), policy.computeDelay(4));
  }

  @Test
  void delayIsCappedAtMaxDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy();

    assertEquals(Duration.ofMinutes(60), policy.computeDelay(5));
    assertEquals(Duration.ofMinutes(60), policy.computeDelay(12));
  }

  @Test
  void sameAttemptAlwaysYieldsSameDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 10_000);

    assertEquals(policy.computeDelay(3), policy.computeDelay(3));
    assertEquals(Duration.ofMillis(400), policy.computeDelay(3));
  }

  @Test
  void zeroOrNegativeAttemptsReturnZero() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy();

    assertEquals(Duration.ZERO, policy.computeDelay(0));
    assertEquals(Duration.ZERO, policy.computeDelay(-1));
  }

  @Test
  void veryLargeAttemptCountDoesNotOverflow() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 60_000);

    assertEquals(Duration.ofMillis(60_000), policy.computeDelay(62));
    assertEquals(Duration.ofMillis(60_000), policy.computeDelay(100));
    assertEquals(Duration.ofMillis(60_000), policy.computeDelay(Integer.MAX_VALUE));
  }

  @Test
  void rejectsInvalidDelays() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0, 100));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(200, 100));
  }
}
