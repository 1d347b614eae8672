package runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sqlmigrator.exceptions.MigrateException;
import sqlmigrator.ledger.AppliedRecord;
import sqlmigrator.ledger.MigrationLedger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * Ledger stored in the {@code schema_migrations} table.
 *
 * <p>Runs in auto-commit mode on the shared connection; each call is its own transaction.
 */
public class JdbcMigrationLedger implements MigrationLedger {

    private static final Logger log = LoggerFactory.getLogger(JdbcMigrationLedger.class);

    static final String CREATE_TABLE =
            "CREATE TABLE IF NOT EXISTS schema_migrations (" +
            " version VARCHAR(255) PRIMARY KEY," +
            " name VARCHAR(255) NOT NULL," +
            " applied_at TIMESTAMP NOT NULL DEFAULT NOW()," +
            " execution_time_ms BIGINT," +
            " checksum VARCHAR(64))";

    private static final String SELECT_APPLIED =
            "SELECT version, name, applied_at, execution_time_ms, checksum " +
            "FROM schema_migrations ORDER BY applied_at, version";

    private static final String INSERT =
            "INSERT INTO schema_migrations (version, name, execution_time_ms, checksum) VALUES (?, ?, ?, ?)";

    private static final String DELETE =
            "DELETE FROM schema_migrations WHERE version = ?";

    private final Connection connection;

    public JdbcMigrationLedger(Connection connection) {
        this.connection = connection;
    }

    /**
     * Creates the ledger table if it does not exist.
     */
    public void initialize() throws MigrateException {
        try (Statement st = connection.createStatement()) {
            st.execute(CREATE_TABLE);
            log.debug("Ledger table schema_migrations verified");
        } catch (SQLException e) {
            throw new MigrateException("Failed to create schema_migrations: " + e.getMessage(), e);
        }
    }

    @Override
    public List<AppliedRecord> getApplied() throws MigrateException {
        List<AppliedRecord> records = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(SELECT_APPLIED);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                Timestamp appliedAt = rs.getTimestamp("applied_at");
                long ms = rs.getLong("execution_time_ms");
                Long executionTimeMs = rs.wasNull() ? null : ms;
                records.add(new AppliedRecord(
                        rs.getString("version"),
                        rs.getString("name"),
                        appliedAt != null ? appliedAt.toInstant() : null,
                        executionTimeMs,
                        rs.getString("checksum")));
            }
        } catch (SQLException e) {
            throw new MigrateException("Failed to read schema_migrations: " + e.getMessage(), e);
        }
        return records;
    }

    @Override
    public void record(String version, String name, long executionTimeMs, String checksum) throws MigrateException {
        try (PreparedStatement ps = connection.prepareStatement(INSERT)) {
            ps.setString(1, version);
            ps.setString(2, name);
            ps.setLong(3, executionTimeMs);
            ps.setString(4, checksum);
            ps.executeUpdate();
            log.debug("Recorded {} - {}", version, name);
        } catch (SQLException e) {
            throw new MigrateException("Failed to record migration: " + e.getMessage(),
                    version, null, MigrateException.NO_STATEMENT, "ledger", e);
        }
    }

    @Override
    public void remove(String version) throws MigrateException {
        try (PreparedStatement ps = connection.prepareStatement(DELETE)) {
            ps.setString(1, version);
            if (ps.executeUpdate() == 0) {
                log.warn("Migration record not found: {}", version);
            }
        } catch (SQLException e) {
            throw new MigrateException("Failed to remove migration record: " + e.getMessage(),
                    version, null, MigrateException.NO_STATEMENT, "ledger", e);
        }
    }
}
