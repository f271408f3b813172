package io.syncbridge.model;

/**
 * Delivery policy for a correlation group.
 */
public enum GroupPolicy {
  /** Item k+1 is dispatched only after item k completed; a dead item skips the rest. */
  ALL_OR_NOTHING,
  /** Every item is attempted; failures are reported per group. */
  BEST_EFFORT
}
