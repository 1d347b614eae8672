package runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sqlmigrator.exceptions.MigrateException;
import sqlmigrator.lock.MigrationLock;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Session-level PostgreSQL advisory lock keyed by {@code hashtext(key)}.
 *
 * <p>The lock belongs to the connection's session, so it is dropped when the
 * connection closes even if {@link #release()} never runs.
 */
public class AdvisoryMigrationLock implements MigrationLock {

    private static final Logger log = LoggerFactory.getLogger(AdvisoryMigrationLock.class);

    private final Connection connection;
    private final String key;

    public AdvisoryMigrationLock(Connection connection, String key) {
        this.connection = connection;
        this.key = key;
    }

    @Override
    public void acquire() throws MigrateException {
        try (PreparedStatement ps = connection.prepareStatement("SELECT pg_advisory_lock(hashtext(?))")) {
            ps.setString(1, key);
            ps.execute();
            log.info("Migration lock acquired: {}", key);
        } catch (SQLException e) {
            throw new MigrateException("Could not acquire migration lock '" + key + "': " + e.getMessage(), e);
        }
    }

    @Override
    public void release() throws MigrateException {
        try (PreparedStatement ps = connection.prepareStatement("SELECT pg_advisory_unlock(hashtext(?))")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next() && !rs.getBoolean(1)) {
                    log.warn("Migration lock '{}' was not held by this session", key);
                    return;
                }
            }
            log.info("Migration lock released: {}", key);
        } catch (SQLException e) {
            throw new MigrateException("Could not release migration lock '" + key + "': " + e.getMessage(), e);
        }
    }
}
