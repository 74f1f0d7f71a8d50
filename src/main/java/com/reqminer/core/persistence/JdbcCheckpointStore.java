package com.reqminer.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * JDBC-based {@link CheckpointStore} that keeps one row per session.
 * <p>
 * The snapshot is stored as JSON. Saving updates the existing row and falls back
 * to an insert when the session has none, which keeps the SQL portable across
 * databases without a vendor-specific upsert. The table is created by
 * {@link #createTables()}.
 */
public class JdbcCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointStore.class);

    private static final Pattern TABLE_NAME_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                session_id  VARCHAR(255) NOT NULL PRIMARY KEY,
                status      VARCHAR(64)  NOT NULL,
                snapshot    TEXT         NOT NULL,
                saved_at    TIMESTAMP    NOT NULL
            )
            """;

    private static final String UPDATE_SQL = """
            UPDATE %s SET status = ?, snapshot = ?, saved_at = ?
            WHERE session_id = ?
            """;

    private static final String INSERT_SQL = """
            INSERT INTO %s (session_id, status, snapshot, saved_at)
            VALUES (?, ?, ?, ?)
            """;

    private static final String SELECT_SQL = """
            SELECT snapshot FROM %s WHERE session_id = ?
            """;

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE session_id = ?
            """;

    private final DataSource dataSource;
    private final SnapshotCodec codec;
    private final String tableName;

    public JdbcCheckpointStore(DataSource dataSource, SnapshotCodec codec, String tableName) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        if (tableName == null || !TABLE_NAME_PATTERN.matcher(tableName).matches()) {
            throw new IllegalArgumentException("Invalid checkpoint table name: " + tableName);
        }
        this.tableName = tableName;
    }

    /**
     * Creates the checkpoint table if it does not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL.formatted(tableName))) {
            stmt.execute();
            log.info("Checkpoint table '{}' ensured", tableName);
        }
    }

    @Override
    public void save(MiningSnapshot snapshot) {
        String json = codec.encode(snapshot);
        Timestamp savedAt = Timestamp.from(snapshot.savedAt());

        try (Connection conn = dataSource.getConnection()) {
            int updated;
            try (PreparedStatement update = conn.prepareStatement(UPDATE_SQL.formatted(tableName))) {
                update.setString(1, snapshot.status().name());
                update.setString(2, json);
                update.setTimestamp(3, savedAt);
                update.setString(4, snapshot.sessionId());
                updated = update.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement insert = conn.prepareStatement(INSERT_SQL.formatted(tableName))) {
                    insert.setString(1, snapshot.sessionId());
                    insert.setString(2, snapshot.status().name());
                    insert.setString(3, json);
                    insert.setTimestamp(4, savedAt);
                    insert.executeUpdate();
                }
            }
            log.debug("Saved checkpoint for session '{}' ({})", snapshot.sessionId(),
                    updated == 0 ? "inserted" : "updated");
        } catch (SQLException e) {
            log.error("Failed to save checkpoint for session '{}'", snapshot.sessionId(), e);
            throw new IllegalStateException("Failed to save checkpoint for session " + snapshot.sessionId(), e);
        }
    }

    @Override
    public Optional<MiningSnapshot> load(String sessionId) {
        String json = null;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SQL.formatted(tableName))) {
            stmt.setString(1, sessionId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    json = rs.getString("snapshot");
                }
            }
        } catch (SQLException e) {
            log.error("Failed to load checkpoint for session '{}'", sessionId, e);
            throw new IllegalStateException("Failed to load checkpoint for session " + sessionId, e);
        }
        if (json == null) {
            return Optional.empty();
        }
        return Optional.of(codec.decode(sessionId, json));
    }

    @Override
    public boolean delete(String sessionId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_SQL.formatted(tableName))) {
            stmt.setString(1, sessionId);
            int deleted = stmt.executeUpdate();
            log.debug("Deleted {} checkpoint row(s) for session '{}'", deleted, sessionId);
            return deleted > 0;
        } catch (SQLException e) {
            log.error("Failed to delete checkpoint for session '{}'", sessionId, e);
            throw new IllegalStateException("Failed to delete checkpoint for session " + sessionId, e);
        }
    }

    @Override
    public String describe() {
        return "jdbc table " + tableName;
    }
}
