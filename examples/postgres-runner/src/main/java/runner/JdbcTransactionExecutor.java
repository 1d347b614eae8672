package runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sqlmigrator.exceptions.MigrateException;
import sqlmigrator.exceptions.StatementExecutionException;
import sqlmigrator.exec.TransactionExecutor;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Runs one migration's statements in a single JDBC transaction.
 *
 * <p>Statements that carry their own {@code BEGIN;} / {@code COMMIT;} are sent as
 * written; PostgreSQL commits them itself and the final {@code commit()} has no
 * further effect.
 */
public class JdbcTransactionExecutor implements TransactionExecutor {

    private static final Logger log = LoggerFactory.getLogger(JdbcTransactionExecutor.class);

    private final Connection connection;

    public JdbcTransactionExecutor(Connection connection) {
        this.connection = connection;
    }

    @Override
    public void runInTransaction(List<String> statements) throws StatementExecutionException {
        boolean autoCommit;
        try {
            autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            throw new StatementExecutionException("Failed to open transaction: " + e.getMessage(),
                    MigrateException.NO_STATEMENT, e);
        }

        int current = MigrateException.NO_STATEMENT;
        try (Statement st = connection.createStatement()) {
            for (int i = 0; i < statements.size(); i++) {
                current = i;
                String sql = statements.get(i);
                log.debug("Executing statement {}: {}", i, abbreviate(sql));
                st.execute(sql);
            }
            current = MigrateException.NO_STATEMENT;
            connection.commit();
        } catch (SQLException e) {
            rollbackAfterFailure();
            throw new StatementExecutionException(e.getMessage(), current, e);
        } finally {
            restoreAutoCommit(autoCommit);
        }
    }

    private void rollbackAfterFailure() {
        try {
            connection.rollback();
            log.debug("Transaction rolled back");
        } catch (SQLException e) {
            log.warn("Rollback failed: {}", e.getMessage(), e);
        }
    }

    private void restoreAutoCommit(boolean autoCommit) {
        try {
            connection.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            log.warn("Failed to restore auto-commit: {}", e.getMessage(), e);
        }
    }

    private static String abbreviate(String sql) {
        String oneLine = sql.replaceAll("\\s+", " ");
        return oneLine.length() > 100 ? oneLine.substring(0, 100) + "..." : oneLine;
    }
}
