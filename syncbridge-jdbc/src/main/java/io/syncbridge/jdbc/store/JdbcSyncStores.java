package io.syncbridge.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of JDBC sync queue stores with auto-detection from the JDBC URL.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.syncbridge.jdbc.store.AbstractJdbcSyncQueueStore}.
 *
 * <pre>{@code
 * AbstractJdbcSyncQueueStore store = JdbcSyncStores.detect(dataSource);
 * AbstractJdbcSyncQueueStore pg = JdbcSyncStores.get("postgresql");
 * }</pre>
 */
public final class JdbcSyncStores {

  private static final List<AbstractJdbcSyncQueueStore> STORES;
  private static final Map<String, AbstractJdbcSyncQueueStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcSyncQueueStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcSyncQueueStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(), store);
    }
  }

  private JdbcSyncStores() {
  }

  public static List<AbstractJdbcSyncQueueStore> all() {
    return STORES;
  }

  /**
   * @param name store name (case-insensitive)
   * @throws IllegalArgumentException if no store has that name
   */
  public static AbstractJdbcSyncQueueStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcSyncQueueStore store = BY_NAME.get(name.toLowerCase());
    if (store == null) {
      throw new IllegalArgumentException("Unknown sync queue store: " + name + ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Detects the store from the URL of a connection obtained from {@code dataSource}.
   *
   * @throws IllegalStateException if the URL cannot be read
   */
  public static AbstractJdbcSyncQueueStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect sync queue store from DataSource", e);
    }
  }

  /**
   * @throws IllegalArgumentException if no store handles the URL
   */
  public static AbstractJdbcSyncQueueStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String url = jdbcUrl.toLowerCase();
    for (AbstractJdbcSyncQueueStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix.toLowerCase())) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No sync queue store found for JDBC URL: " + jdbcUrl
        + ". Supported prefixes: " + STORES.stream().flatMap(s -> s.jdbcUrlPrefixes().stream()).toList());
  }
}
