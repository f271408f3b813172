package io.syncbridge.dispatch;

/**
 * Strategy for computing the delay before a failed item or workflow step is retried.
 *
 * @see ExponentialBackoffRetryPolicy
 * @see StepScheduleRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next attempt.
     *
     * @param retryCount failed attempts so far (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int retryCount);
}
