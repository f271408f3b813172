/**
 * Internal helpers: JSON mapping, HTTP requests, identifiers and thread factories.
 */
package io.syncbridge.util;
