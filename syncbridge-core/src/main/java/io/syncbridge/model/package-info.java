/**
 * Persistent data model of the sync queue: configs, queue items, dead-letter entries
 * and monitoring views.
 */
package io.syncbridge.model;
