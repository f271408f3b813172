/**
 * Immediate processor triggers fired after a capturing transaction commits.
 */
package io.syncbridge.trigger;
