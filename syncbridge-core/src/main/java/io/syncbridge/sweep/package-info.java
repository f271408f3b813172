/**
 * Periodic sweep that re-triggers processing and runs due workflow executions.
 */
package io.syncbridge.sweep;
