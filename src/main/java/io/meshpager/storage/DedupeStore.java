package io.meshpager.storage;

import io.meshpager.model.ForwardStatus;
import io.meshpager.model.ProcessedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of packet ids the bridge has already taken ownership of.
 *
 * <p>{@link #recordPending} is the dedupe gate: the insert is conditional on the primary key, so
 * concurrent or repeated deliveries of one packet id yield exactly one {@link RecordResult#UNIQUE}.
 * A {@link ForwardStatus#DELIVERED} row is never rewritten.
 */
public final class DedupeStore implements AutoCloseable {
    public static final int DEFAULT_BUSY_ATTEMPTS = 3;
    public static final Duration DEFAULT_BUSY_RETRY_DELAY = Duration.ofMillis(50);

    private static final Logger log = LoggerFactory.getLogger(DedupeStore.class);
    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;

    private final Database database;
    private final int busyAttempts;
    private final Duration busyRetryDelay;
    private final Clock clock;

    public DedupeStore(Database database) {
        this(database, DEFAULT_BUSY_ATTEMPTS, DEFAULT_BUSY_RETRY_DELAY, Clock.systemUTC());
    }

    public DedupeStore(Database database, int busyAttempts, Duration busyRetryDelay, Clock clock) {
        this.database = database;
        this.busyAttempts = Math.max(1, busyAttempts);
        this.busyRetryDelay = busyRetryDelay;
        this.clock = clock;
    }

    public boolean hasSeen(long packetId) {
        return withBusyRetry("hasSeen", () -> {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement("SELECT 1 FROM processed_messages WHERE packet_id=?")) {
                ps.setLong(1, packetId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next();
                }
            }
        });
    }

    public RecordResult recordPending(long packetId, long fromNodeId, String text) {
        long nowMs = clock.millis();
        return withBusyRetry("recordPending", () -> {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement("""
                         INSERT INTO processed_messages(packet_id,from_node_id,text,forward_status,created_at_ms,updated_at_ms)
                         VALUES(?,?,?,?,?,?)
                         ON CONFLICT(packet_id) DO NOTHING
                         """)) {
                ps.setLong(1, packetId);
                ps.setLong(2, fromNodeId);
                ps.setString(3, text == null ? "" : text);
                ps.setString(4, ForwardStatus.PENDING.name());
                ps.setLong(5, nowMs);
                ps.setLong(6, nowMs);
                return ps.executeUpdate() == 1 ? RecordResult.UNIQUE : RecordResult.ALREADY_EXISTS;
            }
        });
    }

    public void markOutcome(long packetId, ForwardStatus status) {
        if (status == null || status == ForwardStatus.PENDING) {
            throw new IllegalArgumentException("outcome must be DELIVERED or FAILED, got " + status);
        }
        long nowMs = clock.millis();
        int updated = withBusyRetry("markOutcome", () -> {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement(
                         "UPDATE processed_messages SET forward_status=?,updated_at_ms=?,forwarded_at_ms=? WHERE packet_id=? AND forward_status<>?")) {
                ps.setString(1, status.name());
                ps.setLong(2, nowMs);
                if (status == ForwardStatus.DELIVERED) {
                    ps.setLong(3, nowMs);
                } else {
                    ps.setNull(3, java.sql.Types.INTEGER);
                }
                ps.setLong(4, packetId);
                ps.setString(5, ForwardStatus.DELIVERED.name());
                return ps.executeUpdate();
            }
        });
        if (updated == 0) {
            log.debug("markOutcome({}, {}) left record unchanged", packetId, status);
        }
    }

    public Optional<ProcessedRecord> find(long packetId) {
        return withBusyRetry("find", () -> {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement(
                         "SELECT packet_id,from_node_id,text,forward_status,created_at_ms,updated_at_ms,forwarded_at_ms FROM processed_messages WHERE packet_id=?")) {
                ps.setLong(1, packetId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(toRecord(rs)) : Optional.<ProcessedRecord>empty();
                }
            }
        });
    }

    public List<ProcessedRecord> recent(int limit) {
        int safeLimit = Math.max(1, limit);
        return withBusyRetry("recent", () -> {
            List<ProcessedRecord> out = new ArrayList<>();
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement(
                         "SELECT packet_id,from_node_id,text,forward_status,created_at_ms,updated_at_ms,forwarded_at_ms FROM processed_messages ORDER BY updated_at_ms DESC, packet_id DESC LIMIT ?")) {
                ps.setInt(1, safeLimit);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(toRecord(rs));
                    }
                }
            }
            return out;
        });
    }

    @Override
    public void close() {
        database.checkpoint();
        log.info("Dedupe store closed: {}", database.dbFile());
    }

    private ProcessedRecord toRecord(ResultSet rs) throws SQLException {
        long forwardedAt = rs.getLong("forwarded_at_ms");
        Long forwardedAtMs = rs.wasNull() ? null : forwardedAt;
        return new ProcessedRecord(
                rs.getLong("packet_id"),
                rs.getLong("from_node_id"),
                rs.getString("text"),
                ForwardStatus.fromString(rs.getString("forward_status")),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms"),
                forwardedAtMs
        );
    }

    private <T> T withBusyRetry(String operation, SqlWork<T> work) {
        for (int attempt = 1; ; attempt++) {
            try {
                return work.run();
            } catch (SQLException e) {
                if (!isBusy(e)) {
                    throw new PersistenceException("Failed " + operation, e);
                }
                if (attempt >= busyAttempts) {
                    throw new PersistenceBusyException(operation, attempt, e);
                }
                log.warn("Database busy during {} (attempt {}/{}), retrying in {} ms",
                        operation, attempt, busyAttempts, busyRetryDelay.toMillis());
                try {
                    Thread.sleep(busyRetryDelay.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new PersistenceBusyException(operation, attempt, e);
                }
            }
        }
    }

    static boolean isBusy(SQLException e) {
        int primary = e.getErrorCode() & 0xFF;
        return primary == SQLITE_BUSY || primary == SQLITE_LOCKED;
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run() throws SQLException;
    }

    public enum RecordResult {
        UNIQUE,
        ALREADY_EXISTS
    }
}
