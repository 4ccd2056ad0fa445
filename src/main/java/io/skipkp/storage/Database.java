package io.skipkp.storage;

import io.skipkp.config.KeyProviderConfig;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

/**
 * SQLite file holding key records and their per-peer replication state.
 */
public final class Database {
    private static final int BUSY_TIMEOUT_MS = 5_000;
    private final Path dbFile;
    private final String jdbcUrl;
    private final Properties connectionProperties;

    public Database(KeyProviderConfig config) {
        this(config.dbFile());
    }

    public Database(Path dbFile) {
        this.dbFile = dbFile;
        this.jdbcUrl = "jdbc:sqlite:" + dbFile.toString();
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setBusyTimeout(BUSY_TIMEOUT_MS);
        sqlite.enforceForeignKeys(true);
        // Write transactions take the lock at BEGIN, so a consume never upgrades a stale read snapshot.
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        this.connectionProperties = sqlite.toProperties();
    }

    public void init() {
        initDirectories();
        applyAndValidatePragmas();
        initSchema();
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl, connectionProperties);
        try (Statement st = conn.createStatement()) {
            // Freed pages are overwritten, so erased key material does not linger in the file.
            st.execute("PRAGMA secure_delete=ON");
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    public Path dbFile() {
        return dbFile;
    }

    /**
     * Cheap round trip used by the health endpoint.
     */
    public boolean ping() {
        try (Connection conn = openConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT 1")) {
            return rs.next();
        } catch (SQLException e) {
            return false;
        }
    }

    private void initDirectories() {
        try {
            if (dbFile.getParent() != null) {
                Files.createDirectories(dbFile.getParent());
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize data directory for " + dbFile, e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS key_records (
                        key_id TEXT PRIMARY KEY,
                        key_material BLOB,
                        remote_system_id TEXT NOT NULL,
                        size_bits INTEGER NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        consumed INTEGER NOT NULL DEFAULT 0,
                        consumed_at_ms INTEGER,
                        origin TEXT NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS key_peer_state (
                        key_id TEXT NOT NULL,
                        peer_id TEXT NOT NULL,
                        synced_at_ms INTEGER,
                        notified_at_ms INTEGER,
                        PRIMARY KEY(key_id, peer_id),
                        FOREIGN KEY(key_id) REFERENCES key_records(key_id) ON DELETE CASCADE
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_key_records_created ON key_records(created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_key_records_consumed ON key_records(consumed, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_key_peer_state_peer ON key_peer_state(peer_id)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "foreign_keys", "1");
            validatePragma(st, "secure_delete", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }
}
