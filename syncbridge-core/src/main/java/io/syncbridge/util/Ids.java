package io.syncbridge.util;

import com.github.f4b6a3.ulid.UlidCreator;

/**
 * Identifier generation for queue items, dead-letter entries and workflow executions.
 */
public final class Ids {

  private Ids() {
  }

  /** Monotonic ULID; lexical order follows creation order. */
  public static String newId() {
    return UlidCreator.getMonotonicUlid().toString();
  }
}
