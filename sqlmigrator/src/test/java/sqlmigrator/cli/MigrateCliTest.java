package sqlmigrator.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import sqlmigrator.alert.MigrationAlertLogger;
import sqlmigrator.config.AlertLevel;
import sqlmigrator.engine.ExecutedMigration;
import sqlmigrator.engine.MigrationOrchestrator;
import sqlmigrator.engine.Operation;
import sqlmigrator.engine.RunReport;
import sqlmigrator.exceptions.MigrateException;
import sqlmigrator.exceptions.StatementExecutionException;
import sqlmigrator.file.MigrationCreator;
import sqlmigrator.ledger.AppliedRecord;
import sqlmigrator.metrics.RunMetricsCollector;
import sqlmigrator.parse.Direction;
import sqlmigrator.status.StatusReport;
import sqlmigrator.validate.ValidationReport;
import sqlmigrator.validate.ValidationResult;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("MigrateCli")
class MigrateCliTest {

    @TempDir
    Path dir;

    @Mock
    private MigrationOrchestrator orchestrator;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private final AtomicInteger opened = new AtomicInteger();

    private MigrateCli cli;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        cli = new MigrateCli(
                () -> {
                    opened.incrementAndGet();
                    return orchestrator;
                },
                new MigrationCreator(dir),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
        MigrationAlertLogger.setAlertLevel(null);
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private static RunReport report(Operation op, boolean dryRun, List<String> targets, List<ExecutedMigration> executed) {
        return new RunReport(op, dryRun, targets, executed, List.of(),
                new RunMetricsCollector().start(1, op.name()).finish());
    }

    @Nested
    @DisplayName("up")
    class Up {

        @Test
        @DisplayName("should report no pending migrations")
        void shouldReportNoPending() throws Exception {
            when(orchestrator.up(false)).thenReturn(report(Operation.APPLY_ALL_PENDING, false, List.of(), List.of()));

            assertThat(cli.execute("up")).isEqualTo(MigrateCli.OK);
            assertThat(out()).contains("No pending migrations");
        }

        @Test
        @DisplayName("should print applied migrations")
        void shouldPrintApplied() throws Exception {
            when(orchestrator.up(false)).thenReturn(report(Operation.APPLY_ALL_PENDING, false,
                    List.of("20240101"),
                    List.of(new ExecutedMigration("20240101", "create users", Direction.UP, 12, 3))));

            assertThat(cli.execute("up")).isEqualTo(MigrateCli.OK);
            assertThat(out())
                    .contains("UP 20240101_create users (3 statements, 12ms)")
                    .contains("Done: 1 migration(s)");
        }

        @Test
        @DisplayName("should pass dry-run flag given in any position")
        void shouldPassDryRun() throws Exception {
            when(orchestrator.up(true)).thenReturn(report(Operation.APPLY_ALL_PENDING, true,
                    List.of("20240101", "20240102"), List.of()));

            assertThat(cli.execute("--dry-run", "up")).isEqualTo(MigrateCli.OK);
            verify(orchestrator).up(true);
            assertThat(out()).contains("Dry run: would apply 2 migration(s):").contains("  20240102");
        }

        @Test
        @DisplayName("should exit 1 on migration failure")
        void shouldExitOneOnFailure() throws Exception {
            when(orchestrator.up(false)).thenThrow(
                    new StatementExecutionException("syntax error", 0, null)
                            .withContext("20240101", "20240101_a.sql", "apply"));

            assertThat(cli.execute("up")).isEqualTo(MigrateCli.FAILED);
            assertThat(err()).startsWith("Migration failed: Statement execution failed");
        }

        @Test
        @DisplayName("verbose should raise alert level and print stack trace")
        void verboseShouldRaiseAlertLevel() throws Exception {
            when(orchestrator.up(false)).thenThrow(new StatementExecutionException("boom", 0, null));

            assertThat(cli.execute("up", "--verbose")).isEqualTo(MigrateCli.FAILED);
            assertThat(MigrationAlertLogger.getAlertLevel()).isEqualTo(AlertLevel.DEBUG);
            assertThat(err()).contains("at sqlmigrator.");
        }
    }

    @Nested
    @DisplayName("rollback")
    class Rollback {

        @Test
        @DisplayName("down should report nothing to roll back")
        void downShouldReportNothing() throws Exception {
            when(orchestrator.down(false)).thenReturn(report(Operation.ROLLBACK_ONE, false, List.of(), List.of()));

            assertThat(cli.execute("down")).isEqualTo(MigrateCli.OK);
            assertThat(out()).contains("Nothing to roll back");
        }

        @Test
        @DisplayName("should pass the target version")
        void shouldPassTargetVersion() throws Exception {
            when(orchestrator.rollbackTo("20240101", false)).thenReturn(report(Operation.ROLLBACK_TO_VERSION, false,
                    List.of("20240102"),
                    List.of(new ExecutedMigration("20240102", "b", Direction.DOWN, 4, 1))));

            assertThat(cli.execute("rollback", "20240101")).isEqualTo(MigrateCli.OK);
            verify(orchestrator).rollbackTo("20240101", false);
            assertThat(out()).contains("DOWN 20240102_b");
        }

        @Test
        @DisplayName("should require a version")
        void shouldRequireVersion() {
            assertThat(cli.execute("rollback")).isEqualTo(MigrateCli.USAGE);
            assertThat(err()).contains("Target version is required");
            assertThat(opened).hasValue(0);
        }
    }

    @Nested
    @DisplayName("status and validate")
    class StatusAndValidate {

        @Test
        @DisplayName("status should be the default command")
        void statusShouldBeDefault() throws Exception {
            when(orchestrator.status()).thenReturn(new StatusReport(2,
                    List.of(new AppliedRecord("20240101", "a", Instant.EPOCH, 5L, "abc")),
                    List.of(), List.of(), List.of()));

            assertThat(cli.execute()).isEqualTo(MigrateCli.OK);
            assertThat(out())
                    .contains("Migration files: 2")
                    .contains("Applied: 1")
                    .contains("Pending: 0")
                    .contains("20240101 - a (5ms)");
        }

        @Test
        @DisplayName("validate should exit 1 when a file is invalid")
        void validateShouldFailOnErrors() throws Exception {
            when(orchestrator.validate()).thenReturn(new ValidationReport(false, List.of(
                    new ValidationResult("20240101_a.sql", "20240101", List.of("No DOWN migration found"), List.of()))));

            assertThat(cli.execute("validate")).isEqualTo(MigrateCli.FAILED);
            assertThat(out()).contains("20240101_a.sql: INVALID").contains("error: No DOWN migration found");
        }

        @Test
        @DisplayName("validate should exit 0 when all files are valid")
        void validateShouldSucceed() throws Exception {
            when(orchestrator.validate()).thenReturn(new ValidationReport(true, List.of(
                    new ValidationResult("20240101_a.sql", "20240101", List.of(), List.of()))));

            assertThat(cli.execute("validate")).isEqualTo(MigrateCli.OK);
            assertThat(out()).contains("1 file(s), 0 error(s), 0 warning(s)");
        }

        @Test
        @DisplayName("should exit 1 when the orchestrator cannot be opened")
        void shouldFailWhenOpenFails() {
            MigrateCli broken = new MigrateCli(
                    () -> {
                        throw new IllegalStateException("migrator.datasource.url is required");
                    },
                    new MigrationCreator(dir),
                    new PrintStream(out, true, StandardCharsets.UTF_8),
                    new PrintStream(err, true, StandardCharsets.UTF_8));

            assertThat(broken.execute("status")).isEqualTo(MigrateCli.FAILED);
            assertThat(err()).contains("migrator.datasource.url is required");
        }
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("should write a file without opening the orchestrator")
        void shouldWriteFile() throws Exception {
            assertThat(cli.execute("create", "add_users")).isEqualTo(MigrateCli.OK);

            try (var files = Files.list(dir)) {
                assertThat(files.map(p -> p.getFileName().toString()))
                        .singleElement()
                        .satisfies(name -> assertThat(name).endsWith("_add_users.sql"));
            }
            assertThat(out()).contains("Migration created:");
            assertThat(opened).hasValue(0);
        }

        @Test
        @DisplayName("should require a name")
        void shouldRequireName() {
            assertThat(cli.execute("create")).isEqualTo(MigrateCli.USAGE);
            assertThat(cli.execute("create", " ")).isEqualTo(MigrateCli.USAGE);
        }
    }

    @Nested
    @DisplayName("test")
    class ConnectionTest {

        private MigrateCli cliWith(MigrateCli.ConnectionCheck check) {
            return new MigrateCli(
                    () -> {
                        opened.incrementAndGet();
                        return orchestrator;
                    },
                    check,
                    new MigrationCreator(dir),
                    new PrintStream(out, true, StandardCharsets.UTF_8),
                    new PrintStream(err, true, StandardCharsets.UTF_8));
        }

        @Test
        @DisplayName("should report a reachable database")
        void shouldReportSuccess() {
            AtomicInteger checks = new AtomicInteger();

            int code = cliWith(checks::incrementAndGet).execute("test");

            assertThat(code).isEqualTo(MigrateCli.OK);
            assertThat(checks).hasValue(1);
            assertThat(out()).contains("Database connection test passed");
            assertThat(opened).hasValue(0);
        }

        @Test
        @DisplayName("should exit 1 when the database is unreachable")
        void shouldFailWhenUnreachable() {
            int code = cliWith(() -> {
                throw new MigrateException("Connection refused");
            }).execute("test");

            assertThat(code).isEqualTo(MigrateCli.FAILED);
            assertThat(err()).contains("Database connection test failed: Connection refused");
        }

        @Test
        @DisplayName("should exit 1 when no connection check is configured")
        void shouldFailWithoutCheck() {
            assertThat(cli.execute("test")).isEqualTo(MigrateCli.FAILED);
            assertThat(err()).contains("not available");
        }
    }

    @Test
    @DisplayName("unknown command should print usage and exit 2")
    void unknownCommandShouldExitTwo() {
        assertThat(cli.execute("frobnicate")).isEqualTo(MigrateCli.USAGE);
        assertThat(err()).contains("Unknown command: frobnicate").contains("Usage: migrate");
    }

    @Test
    @DisplayName("help should print usage")
    void helpShouldPrintUsage() {
        assertThat(cli.execute("--help")).isEqualTo(MigrateCli.OK);
        assertThat(out()).contains("rollback <ver>");
    }
}
