/**
 * Operator alerts and their delivery channels.
 */
package io.syncbridge.alert;
