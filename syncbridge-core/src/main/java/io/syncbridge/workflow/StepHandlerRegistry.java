package io.syncbridge.workflow;

import io.syncbridge.spi.StepHandler;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe map from target function name to {@link StepHandler}.
 */
public final class StepHandlerRegistry {
  private final Map<String, StepHandler> handlers = new ConcurrentHashMap<>();

  /**
   * @throws IllegalStateException if a handler is already registered under {@code targetFunction}
   */
  public StepHandlerRegistry register(String targetFunction, StepHandler handler) {
    Objects.requireNonNull(targetFunction, "targetFunction");
    Objects.requireNonNull(handler, "handler");
    if (handlers.putIfAbsent(targetFunction, handler) != null) {
      throw new IllegalStateException("Step handler already registered: " + targetFunction);
    }
    return this;
  }

  public Optional<StepHandler> find(String targetFunction) {
    return Optional.ofNullable(handlers.get(targetFunction));
  }

  public Set<String> targetFunctions() {
    return Set.copyOf(handlers.keySet());
  }
}
