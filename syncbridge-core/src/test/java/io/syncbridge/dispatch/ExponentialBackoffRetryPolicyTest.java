package io.syncbridge.dispatch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void withoutJitterDoublesEachRetry() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 60_000, 0.0);

    assertEquals(0L, policy.computeDelayMs(0));
    assertEquals(1000L, policy.computeDelayMs(1));
    assertEquals(2000L, policy.computeDelayMs(2));
    assertEquals(4000L, policy.computeDelayMs(3));
  }

  @Test
  void delayIsCapped() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 5000, 0.0);

    assertEquals(5000L, policy.computeDelayMs(10));
    assertEquals(5000L, policy.computeDelayMs(64));
  }

  @Test
  void jitterStaysInRange() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 100_000);

    for (int i = 0; i < 50; i++) {
      long delay = policy.computeDelayMs(2);
      assertTrue(delay >= 1000 && delay < 3000, "got " + delay);
    }
  }

  @Test
  void rejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0, 1000));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(100, -1));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(100, 1000, 1.5));
  }
}
