package io.syncbridge.spi;

/**
 * Starts a queue processing run, locally or on a remote processor endpoint.
 *
 * <p>Fire-and-forget: the call returns before processing finishes.
 */
public interface ProcessorTrigger {

  ProcessorTrigger NONE = batchSize -> {
  };

  /**
   * @param batchSize processing hint forwarded to the processor
   * @throws RuntimeException if the run could not be started
   */
  void fire(int batchSize);
}
