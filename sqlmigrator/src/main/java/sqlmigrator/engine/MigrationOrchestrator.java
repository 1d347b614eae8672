package sqlmigrator.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sqlmigrator.alert.MigrationAlertLogger;
import sqlmigrator.config.MigratorConfig;
import sqlmigrator.exceptions.EmptyMigrationException;
import sqlmigrator.exceptions.LockUnavailableException;
import sqlmigrator.exceptions.MigrateException;
import sqlmigrator.exceptions.MigrationTimeoutException;
import sqlmigrator.exceptions.SourceFileMissingException;
import sqlmigrator.exceptions.StatementExecutionException;
import sqlmigrator.exec.TransactionExecutor;
import sqlmigrator.file.FileCatalog;
import sqlmigrator.file.MigrationFile;
import sqlmigrator.ledger.AppliedRecord;
import sqlmigrator.ledger.MigrationLedger;
import sqlmigrator.lock.MigrationLock;
import sqlmigrator.metrics.RunMetrics;
import sqlmigrator.metrics.RunMetrics.Phase;
import sqlmigrator.metrics.RunMetricsCollector;
import sqlmigrator.parse.Direction;
import sqlmigrator.parse.MigrationParser;
import sqlmigrator.parse.ParsedMigration;
import sqlmigrator.parse.StatementSplitter;
import sqlmigrator.plan.ReconciliationEngine;
import sqlmigrator.status.StatusReport;
import sqlmigrator.validate.MigrationValidator;
import sqlmigrator.validate.ValidationReport;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Orchestrates schema migrations end-to-end:
 *  - acquire the global migration lock (bounded by the configured timeout; a lock
 *    obtained after the timeout expired is released straight away)
 *  - diff the file catalog against the ledger
 *  - execute each target file's up or down block in one transaction, in order
 *  - record or remove the ledger entry after each file
 *  - release the lock, whatever happened
 *
 * Notes:
 *  - The first failure aborts the sequence. Files already applied in the same run stay applied.
 *  - Rollbacks resolve every source file before the first mutation.
 *  - {@link #validate()} and {@link #status()} take no lock and never mutate.
 *  - One run at a time per instance; the lock serialises runs across processes.
 */
public class MigrationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(MigrationOrchestrator.class);

    // run id generator
    private static final AtomicLong RUN_COUNTER = new AtomicLong(1L);

    private final FileCatalog catalog;
    private final MigrationLedger ledger;
    private final MigrationLock lock;
    private final TransactionExecutor executor;
    private final MigratorConfig config;

    private final MigrationParser parser = new MigrationParser();
    private final StatementSplitter splitter = new StatementSplitter();
    private final MigrationValidator validator = new MigrationValidator(parser);

    /**
     * @param catalog the migration file catalog
     * @param ledger the applied-migrations ledger
     * @param lock the global migration lock
     * @param executor the transactional statement executor
     * @param config run configuration, or null for {@link MigratorConfig#DEFAULTS}
     */
    public MigrationOrchestrator(FileCatalog catalog,
                                 MigrationLedger ledger,
                                 MigrationLock lock,
                                 TransactionExecutor executor,
                                 MigratorConfig config) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.lock = Objects.requireNonNull(lock, "lock");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.config = config != null ? config : MigratorConfig.DEFAULTS;

        MigrationAlertLogger.setAlertLevel(this.config.alertLevel());
        log.debug("Orchestrator config: {}", this.config);
    }

    /* ---------------- operations ---------------- */

    /**
     * Applies every pending migration, oldest first.
     *
     * @param dryRun if true, only report what would be applied
     * @return the run report; {@link RunReport#isNoop()} when nothing was pending
     * @throws MigrateException on the first failure; earlier files in the run stay applied
     */
    public RunReport up(boolean dryRun) throws MigrateException {
        return run(Operation.APPLY_ALL_PENDING, dryRun, this::applyPending);
    }

    /**
     * Rolls back the most recently applied migration.
     *
     * @param dryRun if true, only report what would be rolled back
     * @return the run report; {@link RunReport#isNoop()} when the ledger is empty
     * @throws MigrateException if the source file is missing, has no down block, or fails to execute
     */
    public RunReport down(boolean dryRun) throws MigrateException {
        return runRollback(Operation.ROLLBACK_ONE, dryRun, run -> {
            AppliedRecord last = ReconciliationEngine.lastApplied(ledger.getApplied());
            return last == null ? List.of() : List.of(last);
        });
    }

    /**
     * Rolls back every migration applied after {@code version}, newest first.
     * The target itself stays applied.
     *
     * @param version the version to roll back to
     * @param dryRun if true, only report what would be rolled back
     * @return the run report; {@link RunReport#isNoop()} when already at the target
     * @throws sqlmigrator.exceptions.VersionNotFoundException if the version was never applied
     * @throws MigrateException on any other failure
     */
    public RunReport rollbackTo(String version, boolean dryRun) throws MigrateException {
        Objects.requireNonNull(version, "version");
        return runRollback(Operation.ROLLBACK_TO_VERSION, dryRun,
                run -> ReconciliationEngine.rollbackTarget(ledger.getApplied(), version));
    }

    /**
     * Validates every catalog file. Takes no lock and never reads the ledger.
     */
    public ValidationReport validate() throws MigrateException {
        return validator.validate(listCatalog());
    }

    /**
     * Reports applied, pending, drifted and orphaned migrations. Takes no lock.
     */
    public StatusReport status() throws MigrateException {
        List<MigrationFile> files = listCatalog();
        List<AppliedRecord> applied = ledger.getApplied();
        return new StatusReport(
                files.size(),
                applied,
                ReconciliationEngine.pending(files, ReconciliationEngine.appliedVersions(applied)),
                ReconciliationEngine.drifted(files, applied),
                ReconciliationEngine.orphaned(files, applied));
    }

    /* ---------------- run template ---------------- */

    @FunctionalInterface
    private interface RollbackTargets {
        List<AppliedRecord> resolve(RunState run) throws MigrateException;
    }

    @FunctionalInterface
    private interface RunBody {
        void execute(RunState run) throws MigrateException;
    }

    private RunReport runRollback(Operation operation, boolean dryRun, RollbackTargets targets) throws MigrateException {
        return run(operation, dryRun, run -> rollback(run, targets));
    }

    private RunReport run(Operation operation, boolean dryRun, RunBody body) throws MigrateException {
        final long runId = RUN_COUNTER.getAndIncrement();
        final RunState run = new RunState(runId, operation, dryRun);

        MigrationAlertLogger.runStarted(runId, operation.name(), dryRun);

        try {
            run.metrics.timed(Phase.LOCK, () -> acquireLock(runId));
        } catch (MigrateException e) {
            MigrationAlertLogger.runFailed(runId, operation.name(), e, run.metrics.finish());
            throw e;
        }

        try {
            body.execute(run);

            RunMetrics metrics = run.metrics.finish();
            log.info("Run metrics: {}", metrics.summary());
            MigrationAlertLogger.runCompleted(runId, metrics);
            return run.toReport(metrics);

        } catch (MigrateException me) {
            MigrationAlertLogger.runFailed(runId, operation.name(), me, finishMetricsOnError(run));
            throw me;
        } catch (RuntimeException e) {
            MigrationAlertLogger.runFailed(runId, operation.name(), e, finishMetricsOnError(run));
            throw new MigrateException(operation + " failed: " + e.getMessage(), e);
        } finally {
            safeReleaseLock(runId);
        }
    }

    private RunMetrics finishMetricsOnError(RunState run) {
        RunMetrics metrics = run.metrics.finish();
        log.warn("Run failed - metrics: {}", metrics.summary());
        return metrics;
    }

    /* ---------------- apply ---------------- */

    private void applyPending(RunState run) throws MigrateException {
        List<MigrationFile> pending = run.metrics.timed(Phase.RESOLVE, () ->
                ReconciliationEngine.pending(listCatalog(), ReconciliationEngine.appliedVersions(ledger.getApplied())));

        for (MigrationFile f : pending) {
            run.targets.add(f.version());
        }

        if (pending.isEmpty()) {
            log.info("No pending migrations");
            return;
        }

        if (run.dryRun) {
            pending.forEach(f -> log.info("[dry-run] Would apply {}", f.filename()));
            return;
        }

        log.info("Applying {} pending migration(s)", pending.size());
        for (MigrationFile file : pending) {
            run.metrics.timed(Phase.EXECUTE, () -> applyOne(run, file));
        }
    }

    private void applyOne(RunState run, MigrationFile file) throws MigrateException {
        ParsedMigration parsed = parser.parse(file);
        if (parsed.isLegacyFormat()) {
            run.warnings.add(MigrationWarning.legacyFormat(file.version(), file.filename()));
            MigrationAlertLogger.legacyFormat(run.runId, file.version(), file.filename());
        }

        String sql = parsed.upSql();
        if (sql.isEmpty()) {
            throw new EmptyMigrationException(Direction.UP, file.version(), file.filename(), "apply");
        }

        List<String> statements = splitter.split(sql);
        long elapsedMs = executeStatements(statements, file, "apply");

        ledger.record(file.version(), file.name(), elapsedMs, parsed.checksum());

        run.executed.add(new ExecutedMigration(file.version(), file.name(), Direction.UP, elapsedMs, statements.size()));
        run.metrics.migrationProcessed(statements.size());
        MigrationAlertLogger.migrationApplied(run.runId, file.version(), file.filename(), statements.size(), elapsedMs);
        log.info("Applied {} ({} statements, {} ms)", file.filename(), statements.size(), elapsedMs);
    }

    /* ---------------- rollback ---------------- */

    private void rollback(RunState run, RollbackTargets targets) throws MigrateException {
        Map<AppliedRecord, MigrationFile> resolved = run.metrics.timed(Phase.RESOLVE, () -> {
            List<AppliedRecord> records = targets.resolve(run);
            return resolveSources(records);
        });

        for (AppliedRecord r : resolved.keySet()) {
            run.targets.add(r.version());
        }

        if (resolved.isEmpty()) {
            log.info("Nothing to roll back");
            return;
        }

        if (run.dryRun) {
            resolved.values().forEach(f -> log.info("[dry-run] Would roll back {}", f.filename()));
            return;
        }

        log.info("Rolling back {} migration(s)", resolved.size());
        for (Map.Entry<AppliedRecord, MigrationFile> e : resolved.entrySet()) {
            run.metrics.timed(Phase.EXECUTE, () -> revertOne(run, e.getKey(), e.getValue()));
        }
    }

    /**
     * Locates the source file of every record before anything is mutated.
     */
    private Map<AppliedRecord, MigrationFile> resolveSources(List<AppliedRecord> records) throws MigrateException {
        Map<AppliedRecord, MigrationFile> resolved = new LinkedHashMap<>();
        if (records.isEmpty()) {
            return resolved;
        }
        List<MigrationFile> files = listCatalog();
        for (AppliedRecord r : records) {
            MigrationFile file = FileCatalog.findByVersion(files, r.version());
            if (file == null) {
                throw new SourceFileMissingException(r.version());
            }
            resolved.put(r, file);
        }
        return resolved;
    }

    private void revertOne(RunState run, AppliedRecord record, MigrationFile file) throws MigrateException {
        ParsedMigration parsed = parser.parse(file);

        String sql = parsed.downSql();
        if (sql.isEmpty()) {
            // legacy files have no down block either
            throw new EmptyMigrationException(Direction.DOWN, file.version(), file.filename(), "rollback");
        }

        List<String> statements = splitter.split(sql);
        long elapsedMs = executeStatements(statements, file, "rollback");

        ledger.remove(record.version());

        run.executed.add(new ExecutedMigration(record.version(), file.name(), Direction.DOWN, elapsedMs, statements.size()));
        run.metrics.migrationProcessed(statements.size());
        MigrationAlertLogger.migrationReverted(run.runId, record.version(), file.filename(), statements.size(), elapsedMs);
        log.info("Rolled back {} ({} statements, {} ms)", file.filename(), statements.size(), elapsedMs);
    }

    /* ---------------- helpers ---------------- */

    private long executeStatements(List<String> statements, MigrationFile file, String stage) throws MigrateException {
        long start = System.nanoTime();
        try {
            executor.runInTransaction(statements);
        } catch (StatementExecutionException e) {
            throw e.withContext(file.version(), file.filename(), stage);
        } catch (RuntimeException e) {
            throw new MigrateException("Statement execution failed: " + e.getMessage(),
                    file.version(), file.filename(), MigrateException.NO_STATEMENT, stage, e);
        }
        return Duration.ofNanos(System.nanoTime() - start).toMillis();
    }

    private List<MigrationFile> listCatalog() throws MigrateException {
        try {
            return catalog.list();
        } catch (IOException e) {
            throw new MigrateException("Failed to read migrations directory " + catalog.directory()
                    + ": " + e.getMessage(), null, null, MigrateException.NO_STATEMENT, "catalog", e);
        }
    }

    private void acquireLock(long runId) throws LockUnavailableException {
        Duration timeout = config.lockTimeout();
        try {
            TimeoutExecutor.executeWithTimeoutChecked("lockAcquire", timeout, lock::acquire,
                    () -> releaseAbandonedLock(runId));
        } catch (MigrationTimeoutException e) {
            MigrationAlertLogger.lockTimeout(runId, timeout.toMillis());
            throw new LockUnavailableException("Timed out waiting for migration lock", e);
        } catch (LockUnavailableException e) {
            throw e;
        } catch (Exception e) {
            throw new LockUnavailableException("Failed to acquire migration lock: " + e.getMessage(), e);
        }
    }

    private void releaseAbandonedLock(long runId) {
        log.warn("Run {} gave up on the migration lock but it was acquired later; releasing it", runId);
        safeReleaseLock(runId);
    }

    private void safeReleaseLock(long runId) {
        try {
            lock.release();
        } catch (Exception e) {
            MigrationAlertLogger.lockReleaseFailed(runId, e);
        }
    }

    /**
     * Mutable per-run accumulator.
     */
    private static final class RunState {
        final long runId;
        final Operation operation;
        final boolean dryRun;
        final RunMetricsCollector metrics;
        final List<String> targets = new ArrayList<>();
        final List<ExecutedMigration> executed = new ArrayList<>();
        final List<MigrationWarning> warnings = new ArrayList<>();

        RunState(long runId, Operation operation, boolean dryRun) {
            this.runId = runId;
            this.operation = operation;
            this.dryRun = dryRun;
            this.metrics = new RunMetricsCollector().start(runId, operation.name());
        }

        RunReport toReport(RunMetrics metrics) {
            return new RunReport(operation, dryRun, targets, executed, warnings, metrics);
        }
    }
}
