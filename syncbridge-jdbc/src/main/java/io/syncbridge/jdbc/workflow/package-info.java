/**
 * JDBC stores for workflow definitions and executions.
 */
package io.syncbridge.jdbc.workflow;
