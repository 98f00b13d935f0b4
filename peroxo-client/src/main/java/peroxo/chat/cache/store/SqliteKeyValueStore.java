package peroxo.chat.cache.store;

import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Key/value store kept in a local SQLite file, one file per signed-in user.
 */
@Slf4j
public class SqliteKeyValueStore implements KeyValueStore {
    private static final String DB_URL_PREFIX = "jdbc:sqlite:";
    private static final int SQLITE_FULL = 13;

    private final String connectionUrl;
    private final Connection connection;

    public SqliteKeyValueStore(String databaseFile) {
        this.connectionUrl = DB_URL_PREFIX + databaseFile;
        try {
            this.connection = DriverManager.getConnection(connectionUrl);
            createTable();
            log.info("Connected to cache database: {}", connectionUrl);
        } catch (SQLException e) {
            throw new StorageException("Failed to open cache database " + connectionUrl, e);
        }
    }

    /**
     * Database file for a user, e.g. {@code peroxo_cache_42.db}.
     */
    public static String databaseFileFor(String basePath, String identity) {
        String safeIdentity = identity == null ? "anonymous" : identity.replaceAll("[^A-Za-z0-9_-]", "_");
        return basePath + "_" + safeIdentity + ".db";
    }

    private void createTable() throws SQLException {
        String createTableSQL = """
            CREATE TABLE IF NOT EXISTS kv_store (
                store_key TEXT PRIMARY KEY,
                store_value TEXT NOT NULL
            )
            """;

        try (Statement stmt = connection.createStatement()) {
            stmt.execute(createTableSQL);
        }
    }

    @Override
    public synchronized Optional<String> get(String key) {
        String sql = "SELECT store_value FROM kv_store WHERE store_key = ?";

        try (PreparedStatement pstmt = connection.prepareStatement(sql)) {
            pstmt.setString(1, key);
            try (ResultSet rs = pstmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(rs.getString("store_value"));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StorageException("Failed to read " + key, e);
        }
    }

    @Override
    public synchronized void put(String key, String value) {
        String sql = "INSERT INTO kv_store (store_key, store_value) VALUES (?, ?) "
                + "ON CONFLICT(store_key) DO UPDATE SET store_value = excluded.store_value";

        try (PreparedStatement pstmt = connection.prepareStatement(sql)) {
            pstmt.setString(1, key);
            pstmt.setString(2, value);
            pstmt.executeUpdate();
        } catch (SQLException e) {
            if (e.getErrorCode() == SQLITE_FULL) {
                throw new StorageQuotaExceededException("Cache database is full while writing " + key, e);
            }
            throw new StorageException("Failed to write " + key, e);
        }
    }

    @Override
    public synchronized void remove(String key) {
        String sql = "DELETE FROM kv_store WHERE store_key = ?";

        try (PreparedStatement pstmt = connection.prepareStatement(sql)) {
            pstmt.setString(1, key);
            pstmt.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to delete " + key, e);
        }
    }

    @Override
    public synchronized Set<String> keys(String prefix) {
        String sql = "SELECT store_key FROM kv_store WHERE substr(store_key, 1, ?) = ?";
        Set<String> keys = new TreeSet<>();

        try (PreparedStatement pstmt = connection.prepareStatement(sql)) {
            pstmt.setInt(1, prefix.length());
            pstmt.setString(2, prefix);
            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) {
                    keys.add(rs.getString("store_key"));
                }
            }
            return keys;
        } catch (SQLException e) {
            throw new StorageException("Failed to list keys with prefix " + prefix, e);
        }
    }

    @Override
    public synchronized long sizeInBytes(String prefix) {
        String sql = "SELECT COALESCE(SUM(length(CAST(store_key AS BLOB)) + length(CAST(store_value AS BLOB))), 0) "
                + "FROM kv_store WHERE substr(store_key, 1, ?) = ?";

        try (PreparedStatement pstmt = connection.prepareStatement(sql)) {
            pstmt.setInt(1, prefix.length());
            pstmt.setString(2, prefix);
            try (ResultSet rs = pstmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to measure keys with prefix " + prefix, e);
        }
    }

    @Override
    public synchronized void close() {
        try {
            if (!connection.isClosed()) {
                connection.close();
                log.info("Cache database connection closed: {}", connectionUrl);
            }
        } catch (SQLException e) {
            log.error("Error closing cache database {}", connectionUrl, e);
        }
    }
}
