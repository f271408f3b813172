/**
 * Queue processing: claiming due items, delivery, retry scheduling and dead-lettering.
 *
 * @see io.syncbridge.dispatch.QueueProcessor
 */
package io.syncbridge.dispatch;
