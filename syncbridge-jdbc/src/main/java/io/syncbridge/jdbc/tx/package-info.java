/**
 * Manual JDBC transaction management for callers without Spring.
 */
package io.syncbridge.jdbc.tx;
