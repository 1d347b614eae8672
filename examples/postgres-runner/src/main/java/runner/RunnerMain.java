package runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sqlmigrator.cli.MigrateCli;
import sqlmigrator.config.MigratorConfig;
import sqlmigrator.config.MigratorConfigLoader;
import sqlmigrator.engine.MigrationOrchestrator;
import sqlmigrator.exceptions.MigrateException;
import sqlmigrator.file.FileCatalog;
import sqlmigrator.file.MigrationCreator;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Command-line migration runner for PostgreSQL.
 *
 * <p>Reads {@code migrator.properties} (or {@code migrator.yml}) from the classpath,
 * with system-property overrides, opens one JDBC connection on demand and hands
 * the command line to {@link MigrateCli}. The connection backs the ledger, the
 * advisory lock, the executor and the {@code test} command alike.
 *
 * <h2>Usage:</h2>
 * <pre>
 * java -Dmigrator.datasource.url=jdbc:postgresql://localhost/app \
 *      -Dmigrator.datasource.user=app -Dmigrator.datasource.password=secret \
 *      -jar postgres-runner.jar up --dry-run
 * </pre>
 */
public class RunnerMain {

    private static final Logger log = LoggerFactory.getLogger(RunnerMain.class);

    private final MigratorConfig config;
    private Connection connection;

    RunnerMain(MigratorConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        MigratorConfig config = MigratorConfigLoader.loadOrDefaults();
        RunnerMain runner = new RunnerMain(config);

        int exitCode;
        try {
            MigrateCli cli = new MigrateCli(runner::openOrchestrator, runner::testConnection,
                    new MigrationCreator(config.directory()), System.out, System.err);
            exitCode = cli.execute(args);
        } finally {
            runner.close();
        }
        System.exit(exitCode);
    }

    private Connection connect() throws SQLException {
        if (config.datasourceUrl() == null) {
            throw new IllegalStateException("migrator.datasource.url is required");
        }
        if (connection == null) {
            connection = DriverManager.getConnection(
                    config.datasourceUrl(), config.datasourceUser(), config.datasourcePassword());
            log.info("Connected to {}", config.datasourceUrl());
        }
        return connection;
    }

    private void testConnection() throws MigrateException {
        try (Statement st = connect().createStatement();
             ResultSet rs = st.executeQuery("SELECT NOW()")) {
            if (rs.next()) {
                log.info("Database time: {}", rs.getTimestamp(1));
            }
        } catch (SQLException e) {
            throw new MigrateException("Failed to connect to database: " + e.getMessage(), e);
        }
    }

    private MigrationOrchestrator openOrchestrator() {
        try {
            Connection conn = connect();

            JdbcMigrationLedger ledger = new JdbcMigrationLedger(conn);
            ledger.initialize();

            return new MigrationOrchestrator(
                    new FileCatalog(config.directory()),
                    ledger,
                    new AdvisoryMigrationLock(conn, config.lockKey()),
                    new JdbcTransactionExecutor(conn),
                    config);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to connect to database: " + e.getMessage(), e);
        } catch (MigrateException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    private void close() {
        if (connection == null) return;
        try {
            connection.close();
            log.debug("Database connection closed");
        } catch (SQLException e) {
            log.warn("Error closing database connection: {}", e.getMessage(), e);
        }
    }
}
