package io.syncbridge.spi;

import java.util.Map;

/**
 * Runs one workflow step. Registered under a target function name.
 */
@FunctionalInterface
public interface StepHandler {

  /**
   * @param action  step action from the definition
   * @param payload rendered step payload
   * @return step output, merged into the execution context under the step name
   * @throws Exception any failure; the step's failure policy decides what happens next
   */
  Map<String, Object> handle(String action, Map<String, Object> payload) throws Exception;
}
