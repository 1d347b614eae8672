package sqlmigrator.alert;

import sqlmigrator.config.AlertLevel;
import sqlmigrator.metrics.RunMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structured logging for orchestrator run events.
 *
 * <p>Entries are {@code EVENT key=value} lines on the {@code migration} logger,
 * suitable for log aggregators.
 *
 * <h2>Alert Level Configuration:</h2>
 * <ul>
 *   <li>DEBUG: run started/completed, each applied or reverted file, plus everything below</li>
 *   <li>WARNING: legacy-format files, lock release failures, plus everything below</li>
 *   <li>ERROR: run failures and lock timeouts, which are always logged</li>
 * </ul>
 *
 * <h2>Example Output:</h2>
 * <pre>
 * 12:00:00.000 INFO  migration - RUN_STARTED id=3 operation=APPLY_ALL_PENDING dry_run=false
 * 12:00:00.040 INFO  migration - MIGRATION_APPLIED id=3 version=20240101 file=20240101_a.sql statements=2 duration_ms=31
 * 12:00:00.041 WARN  migration - LEGACY_FORMAT id=3 version=20240102 file=20240102_b.sql
 * 12:00:00.090 INFO  migration - RUN_COMPLETED id=3 operation=APPLY_ALL_PENDING duration_ms=90 migrations=2 statements=3
 * </pre>
 */
public final class MigrationAlertLogger {

    private static final Logger log = LoggerFactory.getLogger("migration");

    private static volatile AlertLevel alertLevel = AlertLevel.WARNING;

    private MigrationAlertLogger() {}

    /**
     * Set the alert level for logging; null restores the default (WARNING).
     */
    public static void setAlertLevel(AlertLevel level) {
        alertLevel = level != null ? level : AlertLevel.WARNING;
    }

    public static AlertLevel getAlertLevel() {
        return alertLevel;
    }

    private static boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    private static boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    public static void runStarted(long runId, String operation, boolean dryRun) {
        if (shouldLogInfo()) {
            log.info("RUN_STARTED id={} operation={} dry_run={}", runId, operation, dryRun);
        }
    }

    public static void migrationApplied(long runId, String version, String filename, int statements, long durationMs) {
        if (shouldLogInfo()) {
            log.info("MIGRATION_APPLIED id={} version={} file={} statements={} duration_ms={}",
                    runId, version, filename, statements, durationMs);
        }
    }

    public static void migrationReverted(long runId, String version, String filename, int statements, long durationMs) {
        if (shouldLogInfo()) {
            log.info("MIGRATION_REVERTED id={} version={} file={} statements={} duration_ms={}",
                    runId, version, filename, statements, durationMs);
        }
    }

    /**
     * Log a file without direction markers, treated as up-only.
     */
    public static void legacyFormat(long runId, String version, String filename) {
        if (shouldLogWarn()) {
            log.warn("LEGACY_FORMAT id={} version={} file={}", runId, version, filename);
        }
    }

    public static void runCompleted(long runId, RunMetrics metrics) {
        if (shouldLogInfo()) {
            log.info("RUN_COMPLETED id={} operation={} duration_ms={} migrations={} statements={}",
                    runId,
                    metrics.operation(),
                    metrics.totalDurationMs(),
                    metrics.migrationsProcessed(),
                    metrics.statementsExecuted());
        }
    }

    /**
     * Log a failed run.
     *
     * @param runId the run identifier
     * @param operation the operation name
     * @param error the error that aborted the run
     * @param partialMetrics metrics collected up to the failure (may be null)
     */
    public static void runFailed(long runId, String operation, Throwable error, RunMetrics partialMetrics) {
        // Always log errors
        String errorMsg = error != null ? error.getMessage() : "Unknown error";

        if (partialMetrics != null) {
            log.error("RUN_FAILED id={} operation={} error=\"{}\" duration_ms={} migrations={}",
                    runId, operation, errorMsg,
                    partialMetrics.totalDurationMs(),
                    partialMetrics.migrationsProcessed());
        } else {
            log.error("RUN_FAILED id={} operation={} error=\"{}\"", runId, operation, errorMsg);
        }
    }

    public static void lockTimeout(long runId, long timeoutMs) {
        // Always log errors
        log.error("LOCK_TIMEOUT id={} timeout_ms={}", runId, timeoutMs);
    }

    public static void lockReleaseFailed(long runId, Throwable error) {
        if (shouldLogWarn()) {
            log.warn("LOCK_RELEASE_FAILED id={} error=\"{}\"", runId, error.getMessage(), error);
        }
    }
}
