package io.syncbridge.dispatch;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StepScheduleRetryPolicyTest {

  @Test
  void defaultScheduleWalksTheTable() {
    StepScheduleRetryPolicy policy = new StepScheduleRetryPolicy();

    assertEquals(Duration.ofMinutes(1).toMillis(), policy.computeDelayMs(1));
    assertEquals(Duration.ofMinutes(5).toMillis(), policy.computeDelayMs(2));
    assertEquals(Duration.ofMinutes(15).toMillis(), policy.computeDelayMs(3));
    assertEquals(Duration.ofHours(1).toMillis(), policy.computeDelayMs(5));
  }

  @Test
  void retriesPastTheTableReuseTheLastDelay() {
    StepScheduleRetryPolicy policy = new StepScheduleRetryPolicy(List.of(Duration.ofSeconds(1), Duration.ofSeconds(10)));

    assertEquals(10_000L, policy.computeDelayMs(7));
    assertEquals(0L, policy.computeDelayMs(0));
  }

  @Test
  void rejectsEmptyOrNegativeSchedules() {
    assertThrows(IllegalArgumentException.class, () -> new StepScheduleRetryPolicy(List.of()));
    assertThrows(IllegalArgumentException.class,
        () -> new StepScheduleRetryPolicy(List.of(Duration.ofSeconds(-1))));
  }
}
