/**
 * JDBC infrastructure shared across sub-packages.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code io.syncbridge.jdbc.store}: queue, config and dead-letter stores</li>
 *   <li>{@code io.syncbridge.jdbc.workflow}: workflow definition and execution stores</li>
 *   <li>{@code io.syncbridge.jdbc.purge}: queue purger</li>
 *   <li>{@code io.syncbridge.jdbc.tx}: manual transaction management</li>
 * </ul>
 *
 * <p>Schemas ship as classpath resources {@code schema/h2.sql} and {@code schema/postgresql.sql}.
 */
package io.syncbridge.jdbc;
