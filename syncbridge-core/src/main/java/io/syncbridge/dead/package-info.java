/**
 * Inspection and replay of dead-lettered queue items.
 */
package io.syncbridge.dead;
