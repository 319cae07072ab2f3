package com.gantry.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link StateStore} persisting every record as a JSON text row
 * keyed by {@code (store_name, record_key)}.
 * <p>
 * The version column is the CAS token: updates only apply when the stored
 * version still matches, so several Gantry processes may share one database.
 * The table {@code gantry_state} is created by {@link #createTables()}.
 */
public class JdbcStateStore extends AbstractStateStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcStateStore.class);

    private static final String TABLE_NAME = "gantry_state";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                store_name  VARCHAR(64)  NOT NULL,
                record_key  VARCHAR(255) NOT NULL,
                version     BIGINT       NOT NULL,
                body        TEXT         NOT NULL,
                updated_at  TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                PRIMARY KEY (store_name, record_key)
            )
            """.formatted(TABLE_NAME);

    private static final String SELECT_ONE_SQL = """
            SELECT record_key, version, body
            FROM %s
            WHERE store_name = ? AND record_key = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_ALL_SQL = """
            SELECT record_key, version, body
            FROM %s
            WHERE store_name = ?
            ORDER BY record_key ASC
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (store_name, record_key, version, body)
            VALUES (?, ?, 1, ?)
            """.formatted(TABLE_NAME);

    private static final String UPDATE_SQL = """
            UPDATE %s
            SET version = version + 1, body = ?, updated_at = CURRENT_TIMESTAMP
            WHERE store_name = ? AND record_key = ? AND version = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcStateStore(DataSource dataSource, Duration lockTimeout, boolean strictWrites) {
        super(lockTimeout, strictWrites);
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    /**
     * Creates the state table if it does not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("State table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Optional<VersionedRecord> read(StateNamespace namespace, String key) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ONE_SQL)) {
            stmt.setString(1, namespace.storeName());
            stmt.setString(2, key);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromResultSet(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StateStoreException("Failed to read " + namespace.storeName() + "/" + key, e);
        }
    }

    @Override
    public List<VersionedRecord> list(StateNamespace namespace) {
        List<VersionedRecord> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_SQL)) {
            stmt.setString(1, namespace.storeName());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(fromResultSet(rs));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new StateStoreException("Failed to list " + namespace.storeName(), e);
        }
    }

    @Override
    public boolean compareAndSet(StateNamespace namespace, String key, long expectedVersion, String body) {
        try (Connection conn = dataSource.getConnection()) {
            if (expectedVersion == 0L) {
                return insert(conn, namespace, key, body);
            }
            try (PreparedStatement stmt = conn.prepareStatement(UPDATE_SQL)) {
                stmt.setString(1, body);
                stmt.setString(2, namespace.storeName());
                stmt.setString(3, key);
                stmt.setLong(4, expectedVersion);
                return stmt.executeUpdate() == 1;
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to write " + namespace.storeName() + "/" + key, e);
        }
    }

    private boolean insert(Connection conn, StateNamespace namespace, String key, String body) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, namespace.storeName());
            stmt.setString(2, key);
            stmt.setString(3, body);
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            // 23xxx: integrity constraint violation, i.e. the key already exists
            if (e.getSQLState() != null && e.getSQLState().startsWith("23")) {
                log.debug("Insert of {}/{} lost to a concurrent writer", namespace.storeName(), key);
                return false;
            }
            throw e;
        }
    }

    @Override
    public boolean isHealthy() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(5);
        } catch (SQLException e) {
            log.warn("State store health probe failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String backendName() {
        return "jdbc";
    }

    private VersionedRecord fromResultSet(ResultSet rs) throws SQLException {
        return new VersionedRecord(rs.getString("record_key"), rs.getLong("version"), rs.getString("body"));
    }
}
