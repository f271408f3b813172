/**
 * HTTP clients for the external platform's workflow and data APIs.
 */
package io.syncbridge.platform;
