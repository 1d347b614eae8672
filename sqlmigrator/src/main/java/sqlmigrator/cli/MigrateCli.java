package sqlmigrator.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sqlmigrator.alert.MigrationAlertLogger;
import sqlmigrator.config.AlertLevel;
import sqlmigrator.engine.ExecutedMigration;
import sqlmigrator.engine.MigrationOrchestrator;
import sqlmigrator.engine.MigrationWarning;
import sqlmigrator.engine.Operation;
import sqlmigrator.engine.RunReport;
import sqlmigrator.exceptions.MigrateException;
import sqlmigrator.file.MigrationCreator;
import sqlmigrator.file.MigrationFile;
import sqlmigrator.ledger.AppliedRecord;
import sqlmigrator.status.StatusReport;
import sqlmigrator.validate.ValidationReport;
import sqlmigrator.validate.ValidationResult;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Command-line front end for the migration orchestrator.
 *
 * <pre>
 * up                 Apply all pending migrations
 * down               Roll back the last migration
 * status             Show migration status (default)
 * create &lt;name&gt;      Create a new migration file
 * test               Test the database connection
 * validate           Validate all migration files
 * rollback &lt;ver&gt;     Roll back to a specific version
 *
 * --dry-run          Show what would be done without applying changes
 * --verbose          Log every run event and print stack traces
 * </pre>
 *
 * <p>Exit codes: 0 success, 1 failure or validation errors, 2 usage error.
 */
public final class MigrateCli {

    private static final Logger log = LoggerFactory.getLogger(MigrateCli.class);

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    private final Supplier<MigrationOrchestrator> orchestrator;
    private final ConnectionCheck connectionCheck;
    private final MigrationCreator creator;
    private final PrintStream out;
    private final PrintStream err;

    /**
     * @param orchestrator supplies the orchestrator on first use, so {@code create} needs no database
     * @param creator writes new migration files
     * @param out standard output
     * @param err error output
     */
    public MigrateCli(Supplier<MigrationOrchestrator> orchestrator,
                      MigrationCreator creator,
                      PrintStream out,
                      PrintStream err) {
        this(orchestrator, null, creator, out, err);
    }

    /**
     * @param connectionCheck backs the {@code test} command, may be null when there is no database to check
     */
    public MigrateCli(Supplier<MigrationOrchestrator> orchestrator,
                      ConnectionCheck connectionCheck,
                      MigrationCreator creator,
                      PrintStream out,
                      PrintStream err) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.connectionCheck = connectionCheck;
        this.creator = Objects.requireNonNull(creator, "creator");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    /**
     * Runs one command.
     *
     * @param args command, optional argument and flags, in any order
     * @return the process exit code
     */
    public int execute(String... args) {
        boolean dryRun = false;
        boolean verbose = false;
        List<String> positional = new ArrayList<>();

        for (String arg : args) {
            switch (arg) {
                case "--dry-run" -> dryRun = true;
                case "--verbose" -> verbose = true;
                default -> positional.add(arg);
            }
        }

        String cmd = positional.isEmpty() ? "status" : positional.get(0).toLowerCase(Locale.ROOT);
        String argument = positional.size() > 1 ? positional.get(1) : null;

        try {
            return switch (cmd) {
                case "up" -> printRun(open(verbose).up(dryRun));
                case "down" -> printRun(open(verbose).down(dryRun));
                case "status" -> printStatus(open(verbose).status());
                case "validate" -> printValidation(open(verbose).validate());
                case "rollback" -> {
                    if (argument == null) {
                        err.println("Target version is required. Usage: rollback <version>");
                        yield USAGE;
                    }
                    yield printRun(open(verbose).rollbackTo(argument, dryRun));
                }
                case "create" -> {
                    if (argument == null) {
                        err.println("Migration name is required. Usage: create <name>");
                        yield USAGE;
                    }
                    yield create(argument);
                }
                case "test" -> testConnection();
                case "help", "-h", "--help" -> {
                    printUsage(out);
                    yield OK;
                }
                default -> {
                    err.println("Unknown command: " + positional.get(0));
                    printUsage(err);
                    yield USAGE;
                }
            };
        } catch (MigrateException e) {
            return fail(e, verbose);
        } catch (RuntimeException e) {
            log.error("Unexpected failure running '{}'", cmd, e);
            return fail(e, verbose);
        }
    }

    private MigrationOrchestrator open(boolean verbose) {
        MigrationOrchestrator o = orchestrator.get();
        if (verbose) {
            MigrationAlertLogger.setAlertLevel(AlertLevel.DEBUG);
        }
        return o;
    }

    private int fail(Exception e, boolean verbose) {
        err.println("Migration failed: " + e.getMessage());
        if (verbose) {
            e.printStackTrace(err);
        }
        return FAILED;
    }

    // ----------------- output -----------------

    private int printRun(RunReport report) {
        String verb = switch (report.operation()) {
            case APPLY_ALL_PENDING -> "apply";
            case ROLLBACK_ONE, ROLLBACK_TO_VERSION -> "roll back";
        };

        if (report.isNoop()) {
            out.println(report.operation() == Operation.APPLY_ALL_PENDING
                    ? "No pending migrations"
                    : "Nothing to roll back");
            return OK;
        }

        if (report.dryRun()) {
            out.println("Dry run: would " + verb + " " + report.targets().size() + " migration(s):");
            report.targets().forEach(v -> out.println("  " + v));
            return OK;
        }

        for (ExecutedMigration m : report.executed()) {
            out.printf(Locale.ROOT, "  %s %s_%s (%d statements, %dms)%n",
                    m.direction(), m.version(), m.name(), m.statementCount(), m.executionTimeMs());
        }
        for (MigrationWarning w : report.warnings()) {
            out.println("  warning: " + w.filename() + ": " + w.message());
        }
        out.printf(Locale.ROOT, "Done: %d migration(s) in %dms%n",
                report.executed().size(), report.metrics().totalDurationMs());
        return OK;
    }

    private int printStatus(StatusReport status) {
        out.println("Migration files: " + status.fileCount());
        out.println("Applied: " + status.applied().size());
        out.println("Pending: " + status.pending().size());

        if (!status.applied().isEmpty()) {
            out.println();
            out.println("Applied migrations:");
            for (AppliedRecord r : status.applied()) {
                String duration = r.executionTimeMs() != null ? " (" + r.executionTimeMs() + "ms)" : "";
                out.println("  " + r.version() + " - " + r.name() + duration
                        + (r.appliedAt() != null ? " applied " + r.appliedAt() : ""));
            }
        }
        if (!status.pending().isEmpty()) {
            out.println();
            out.println("Pending migrations:");
            for (MigrationFile f : status.pending()) {
                out.println("  " + f.filename());
            }
        }
        if (!status.drifted().isEmpty()) {
            out.println();
            out.println("Changed since applied (checksum mismatch):");
            status.drifted().forEach(r -> out.println("  " + r.version() + " - " + r.name()));
        }
        if (!status.orphaned().isEmpty()) {
            out.println();
            out.println("Applied but file missing:");
            status.orphaned().forEach(r -> out.println("  " + r.version() + " - " + r.name()));
        }
        return OK;
    }

    private int printValidation(ValidationReport report) {
        for (ValidationResult r : report.results()) {
            out.println(r.filename() + (r.isValid() ? ": valid" : ": INVALID"));
            r.errors().forEach(e -> out.println("  error: " + e));
            r.warnings().forEach(w -> out.println("  warning: " + w.message()));
        }
        out.printf(Locale.ROOT, "%d file(s), %d error(s), %d warning(s)%n",
                report.results().size(), report.errorCount(), report.warningCount());
        return report.success() ? OK : FAILED;
    }

    private int testConnection() {
        if (connectionCheck == null) {
            err.println("Connection test is not available in this runner");
            return FAILED;
        }
        out.println("Testing database connection...");
        try {
            connectionCheck.check();
        } catch (MigrateException e) {
            log.debug("Connection test failed", e);
            err.println("Database connection test failed: " + e.getMessage());
            return FAILED;
        }
        out.println("Database connection test passed");
        return OK;
    }

    private int create(String name) throws MigrateException {
        Path path;
        try {
            path = creator.create(name);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return USAGE;
        }
        out.println("Migration created: " + path.getFileName());
        out.println("Location: " + path);
        return OK;
    }

    static void printUsage(PrintStream ps) {
        ps.println("Usage: migrate <command> [options]");
        ps.println();
        ps.println("Commands:");
        ps.println("  up               Apply all pending migrations");
        ps.println("  down             Roll back the last migration");
        ps.println("  status           Show migration status (default)");
        ps.println("  create <name>    Create a new migration file");
        ps.println("  validate         Validate all migration files");
        ps.println("  rollback <ver>   Roll back to a specific version");
        ps.println("  test             Test the database connection");
        ps.println();
        ps.println("Options:");
        ps.println("  --dry-run        Show what would be done without applying changes");
        ps.println("  --verbose        Log every run event and print stack traces");
    }

    /**
     * Verifies the target database is reachable.
     */
    @FunctionalInterface
    public interface ConnectionCheck {
        void check() throws MigrateException;
    }
}
