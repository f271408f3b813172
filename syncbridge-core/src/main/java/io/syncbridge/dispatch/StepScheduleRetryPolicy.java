package io.syncbridge.dispatch;

import java.time.Duration;
import java.util.List;

/**
 * Retry policy backed by a fixed table of delays. Retry {@code n} waits {@code delays[n-1]};
 * retries beyond the table reuse the last entry.
 */
public final class StepScheduleRetryPolicy implements RetryPolicy {

  /** 1 min, 5 min, 15 min, 30 min, 1 h. */
  public static final List<Duration> DEFAULT_SCHEDULE = List.of(
      Duration.ofMinutes(1),
      Duration.ofMinutes(5),
      Duration.ofMinutes(15),
      Duration.ofMinutes(30),
      Duration.ofHours(1));

  private final long[] delaysMs;

  public StepScheduleRetryPolicy() {
    this(DEFAULT_SCHEDULE);
  }

  public StepScheduleRetryPolicy(List<Duration> schedule) {
    if (schedule == null || schedule.isEmpty()) {
      throw new IllegalArgumentException("schedule must not be empty");
    }
    this.delaysMs = new long[schedule.size()];
    for (int i = 0; i < schedule.size(); i++) {
      Duration delay = schedule.get(i);
      if (delay == null || delay.isNegative()) {
        throw new IllegalArgumentException("schedule entries must be >= 0");
      }
      delaysMs[i] = delay.toMillis();
    }
  }

  @Override
  public long computeDelayMs(int retryCount) {
    if (retryCount <= 0) {
      return 0L;
    }
    return delaysMs[Math.min(retryCount, delaysMs.length) - 1];
  }
}
