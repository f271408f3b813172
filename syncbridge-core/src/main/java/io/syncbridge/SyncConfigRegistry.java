package io.syncbridge;

import io.syncbridge.model.SyncConfig;
import io.syncbridge.spi.ConnectionProvider;
import io.syncbridge.spi.SyncConfigStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read-mostly access to {@link SyncConfig}s with a short-lived in-memory cache.
 *
 * <p>Configs are read on every captured mutation; the cache keeps that lookup off the
 * database. Saves through this registry invalidate the cached entry immediately; edits
 * made elsewhere become visible after the TTL.
 */
public final class SyncConfigRegistry {
  public static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(30);

  private final ConnectionProvider connectionProvider;
  private final SyncConfigStore store;
  private final Duration cacheTtl;
  private final Clock clock;
  private final Map<String, Cached> cache = new ConcurrentHashMap<>();

  public SyncConfigRegistry(ConnectionProvider connectionProvider, SyncConfigStore store) {
    this(connectionProvider, store, DEFAULT_CACHE_TTL, Clock.systemUTC());
  }

  /**
   * @param cacheTtl how long a lookup result is reused; {@link Duration#ZERO} disables caching
   */
  public SyncConfigRegistry(ConnectionProvider connectionProvider, SyncConfigStore store,
      Duration cacheTtl, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(store, "store");
    this.cacheTtl = Objects.requireNonNull(cacheTtl, "cacheTtl");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (cacheTtl.isNegative()) {
      throw new IllegalArgumentException("cacheTtl must be >= 0");
    }
  }

  /**
   * Looks up the config using the caller's connection on a cache miss.
   */
  public Optional<SyncConfig> find(Connection conn, String sourceTable) {
    Objects.requireNonNull(sourceTable, "sourceTable");
    Instant now = clock.instant();
    Cached cached = cache.get(sourceTable);
    if (cached != null && cached.expiresAt.isAfter(now)) {
      return cached.config;
    }
    Optional<SyncConfig> loaded = store.find(conn, sourceTable);
    if (!cacheTtl.isZero()) {
      cache.put(sourceTable, new Cached(loaded, now.plus(cacheTtl)));
    }
    return loaded;
  }

  public Optional<SyncConfig> find(String sourceTable) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return find(conn, sourceTable);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to load sync config for " + sourceTable, e);
    }
  }

  public List<SyncConfig> all() {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return store.findAll(conn);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to list sync configs", e);
    }
  }

  public void save(SyncConfig config) {
    Objects.requireNonNull(config, "config");
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      store.save(conn, config);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to save sync config for " + config.sourceTable(), e);
    } finally {
      cache.remove(config.sourceTable());
    }
  }

  public boolean delete(String sourceTable) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return store.delete(conn, sourceTable);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to delete sync config for " + sourceTable, e);
    } finally {
      cache.remove(sourceTable);
    }
  }

  public void invalidate() {
    cache.clear();
  }

  private record Cached(Optional<SyncConfig> config, Instant expiresAt) {
  }
}
