package sqlmigrator.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable timing and volume figures for one orchestrator run.
 *
 * <p>Use {@link #summary()} for a log line, or {@link #toMap()} for structured output.
 *
 * @param runId process-unique run identifier
 * @param operation the operation name (e.g. {@code APPLY_ALL_PENDING})
 * @param startTime when the run started
 * @param endTime when the run finished
 * @param phaseDurations per-phase wall-clock durations in milliseconds
 * @param totalDurationMs wall-clock duration of the whole run
 * @param migrationsProcessed files applied or reverted
 * @param statementsExecuted statements handed to the executor
 *
 * @see RunMetricsCollector
 */
public record RunMetrics(
        long runId,
        String operation,
        Instant startTime,
        Instant endTime,
        Map<Phase, Long> phaseDurations,
        long totalDurationMs,
        int migrationsProcessed,
        int statementsExecuted
) {
    /**
     * Run phases for timing breakdown.
     */
    public enum Phase {
        /** Waiting for and acquiring the migration lock */
        LOCK,
        /** Reading the catalog and ledger, computing the target set */
        RESOLVE,
        /** Executing statements and updating the ledger */
        EXECUTE
    }

    public RunMetrics {
        phaseDurations = phaseDurations.isEmpty()
                ? new EnumMap<>(Phase.class)
                : new EnumMap<>(phaseDurations);
    }

    /** Returns the total run duration. */
    public Duration totalDuration() {
        return Duration.ofMillis(totalDurationMs);
    }

    /**
     * Returns the duration of a specific phase.
     *
     * @return duration in milliseconds, or 0 if the phase did not run
     */
    public long phaseDuration(Phase phase) {
        return phaseDurations.getOrDefault(phase, 0L);
    }

    public String summary() {
        return String.format(Locale.ROOT,
                "Run #%d %s in %dms | lock %dms, resolve %dms, execute %dms | %d migrations, %d statements",
                runId, operation, totalDurationMs,
                phaseDuration(Phase.LOCK), phaseDuration(Phase.RESOLVE), phaseDuration(Phase.EXECUTE),
                migrationsProcessed, statementsExecuted);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("runId", runId);
        map.put("operation", operation);
        map.put("startTime", startTime.toString());
        map.put("endTime", endTime.toString());
        map.put("totalDurationMs", totalDurationMs);
        map.put("migrationsProcessed", migrationsProcessed);
        map.put("statementsExecuted", statementsExecuted);
        phaseDurations.forEach((phase, duration) ->
                map.put(phase.name().toLowerCase(Locale.ROOT) + "DurationMs", duration));
        return map;
    }
}
