/**
 * Batched deletion of old terminal queue rows.
 */
package io.syncbridge.jdbc.purge;
