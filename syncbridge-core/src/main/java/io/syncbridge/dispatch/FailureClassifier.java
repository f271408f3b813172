package io.syncbridge.dispatch;

import io.syncbridge.DeliveryException;

/**
 * Decides whether a failed delivery is worth retrying.
 */
@FunctionalInterface
public interface FailureClassifier {

  /**
   * Every failure is retried up to the item's retry budget. The platform's rejections cannot
   * be told apart from transient errors without per-error knowledge.
   */
  FailureClassifier RETRY_ALL = failure -> true;

  /**
   * HTTP 4xx answers are permanent and dead-letter the item on first failure;
   * everything else is retried.
   */
  FailureClassifier CLIENT_ERRORS_FATAL = failure -> !failure.isClientError();

  boolean isRetryable(DeliveryException failure);
}
