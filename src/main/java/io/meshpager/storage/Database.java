package io.meshpager.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Properties;

/**
 * SQLite file holding processed-message metadata. Every connection is opened with a busy timeout;
 * the file runs in WAL mode so reads never wait for the writer.
 */
public final class Database {
    public static final Duration DEFAULT_BUSY_TIMEOUT = Duration.ofSeconds(30);

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final Path dbFile;
    private final String jdbcUrl;
    private final Duration busyTimeout;

    public Database(Path dbFile) {
        this(dbFile, DEFAULT_BUSY_TIMEOUT);
    }

    public Database(Path dbFile, Duration busyTimeout) {
        this.dbFile = dbFile.toAbsolutePath().normalize();
        this.jdbcUrl = "jdbc:sqlite:" + this.dbFile;
        this.busyTimeout = busyTimeout;
    }

    public Path dbFile() {
        return dbFile;
    }

    public void init() {
        initDirectories();
        applyAndValidatePragmas();
        initSchema();
        log.info("Database ready: {}", dbFile);
    }

    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", Long.toString(busyTimeout.toMillis()));
        props.setProperty("synchronous", "NORMAL");
        return DriverManager.getConnection(jdbcUrl, props);
    }

    /** Folds the WAL back into the main file. Called once on shutdown. */
    public void checkpoint() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA wal_checkpoint(TRUNCATE)");
        } catch (SQLException e) {
            throw new PersistenceException("Failed to checkpoint " + dbFile, e);
        }
    }

    private void initDirectories() {
        Path parent = dbFile.getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new PersistenceException("Failed to create database directory " + parent, e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS processed_messages (
                        packet_id INTEGER PRIMARY KEY,
                        from_node_id INTEGER NOT NULL,
                        text TEXT NOT NULL,
                        forward_status TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        forwarded_at_ms INTEGER
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_processed_status_updated ON processed_messages(forward_status, updated_at_ms)");
        } catch (SQLException e) {
            throw new PersistenceException("Failed to initialize schema in " + dbFile, e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
        } catch (SQLException e) {
            throw new PersistenceException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new PersistenceException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new PersistenceException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }
}
