package io.syncbridge.spi;

import io.syncbridge.alert.Alert;

/**
 * Operator notification channel. Implementations must not throw and should not block
 * the caller for long.
 */
public interface AlertNotifier {

  void notify(Alert alert);
}
