package io.syncbridge.spi;

import io.syncbridge.model.SyncConfig;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for per-table sync configs.
 */
public interface SyncConfigStore {

    Optional<SyncConfig> find(Connection conn, String sourceTable);

    List<SyncConfig> findAll(Connection conn);

    /**
     * Inserts or replaces the config for {@link SyncConfig#sourceTable()}.
     */
    void save(Connection conn, SyncConfig config);

    /**
     * @return {@code true} if a config was removed
     */
    boolean delete(Connection conn, String sourceTable);
}
