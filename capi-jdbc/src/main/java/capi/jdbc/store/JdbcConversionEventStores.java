package capi.jdbc.store;

import capi.util.JsonCodec;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC conversion event stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/capi.jdbc.store.AbstractJdbcConversionEventStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcConversionEventStore store = JdbcConversionEventStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * AbstractJdbcConversionEventStore store = JdbcConversionEventStores.detect("jdbc:postgresql://localhost/capi");
 *
 * // Get by name
 * AbstractJdbcConversionEventStore store = JdbcConversionEventStores.get("h2");
 * }</pre>
 */
public final class JdbcConversionEventStores {

    private static final List<AbstractJdbcConversionEventStore> STORES;
    private static final Map<String, AbstractJdbcConversionEventStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcConversionEventStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcConversionEventStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
        }
    }

    private JdbcConversionEventStores() {
    }

    /**
     * Returns all registered stores.
     */
    public static List<AbstractJdbcConversionEventStore> all() {
        return STORES;
    }

    /**
     * Gets a store by name.
     *
     * @param name store name (case-insensitive)
     * @return the store
     * @throws IllegalArgumentException if no store is registered under that name
     */
    public static AbstractJdbcConversionEventStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcConversionEventStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        if (store == null) {
            throw new IllegalArgumentException("Unknown conversion event store: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Auto-detects the store from a DataSource.
     *
     * @throws IllegalStateException if detection fails or no store matches
     */
    public static AbstractJdbcConversionEventStore detect(DataSource dataSource) {
        try (Connection conn = dataSource.getConnection()) {
            String url = conn.getMetaData().getURL();
            return detect(url);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect conversion event store from DataSource", e);
        }
    }

    /**
     * Auto-detects the store from a JDBC URL.
     *
     * @throws IllegalArgumentException if no store matches
     */
    public static AbstractJdbcConversionEventStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }

        String lower = jdbcUrl.toLowerCase(Locale.ROOT);
        for (AbstractJdbcConversionEventStore store : STORES) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
                    return store;
                }
            }
        }

        throw new IllegalArgumentException("No conversion event store found for JDBC URL: " + jdbcUrl +
                ". Supported prefixes: " + allPrefixes());
    }

    /**
     * Auto-detects the store from a DataSource and configures it with a table name and codec.
     */
    public static AbstractJdbcConversionEventStore detect(DataSource dataSource, String tableName,
            JsonCodec jsonCodec) {
        Objects.requireNonNull(jsonCodec, "jsonCodec");
        return detect(dataSource).with(tableName, jsonCodec);
    }

    private static List<String> allPrefixes() {
        return STORES.stream()
                .flatMap(s -> s.jdbcUrlPrefixes().stream())
                .toList();
    }
}
