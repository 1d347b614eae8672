package sqlmigrator.engine;

import sqlmigrator.metrics.RunMetrics;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a successful orchestrator run.
 *
 * <p>For a dry run {@code targets} lists what would execute and {@code executed}
 * is empty. Failed runs raise instead of returning a report.
 *
 * @param operation the operation that ran
 * @param dryRun whether the run only reported its targets
 * @param targets versions selected for execution, in execution order
 * @param executed files actually applied or reverted, in execution order
 * @param warnings non-fatal findings, such as legacy-format files
 * @param metrics run timings and counts
 */
public record RunReport(
        Operation operation,
        boolean dryRun,
        List<String> targets,
        List<ExecutedMigration> executed,
        List<MigrationWarning> warnings,
        RunMetrics metrics
) {
    public RunReport {
        Objects.requireNonNull(operation, "operation");
        targets = List.copyOf(targets);
        executed = List.copyOf(executed);
        warnings = List.copyOf(warnings);
    }

    /** Returns true if there was nothing to do. */
    public boolean isNoop() {
        return targets.isEmpty();
    }
}
