package io.syncbridge.alert;

import io.syncbridge.spi.AlertNotifier;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes alerts to the log at {@link Level#SEVERE}. Default channel.
 */
public final class LoggingAlertNotifier implements AlertNotifier {
  private static final Logger logger = Logger.getLogger(LoggingAlertNotifier.class.getName());

  @Override
  public void notify(Alert alert) {
    logger.log(Level.SEVERE, "Sync alert {0}", alert.summary());
  }
}
