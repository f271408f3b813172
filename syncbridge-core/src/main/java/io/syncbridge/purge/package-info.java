/**
 * Retention-based purge of terminal queue rows.
 */
package io.syncbridge.purge;
