package sqlmigrator.metrics;

import sqlmigrator.metrics.RunMetrics.Phase;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Collects timing and counts for one orchestrator run.
 *
 * <h2>Usage:</h2>
 * <pre>
 * RunMetricsCollector collector = new RunMetricsCollector();
 * collector.start(runId, "APPLY_ALL_PENDING");
 *
 * List&lt;MigrationFile&gt; pending = collector.timed(Phase.RESOLVE, () -&gt; resolve());
 * collector.migrationProcessed(statements.size());
 *
 * RunMetrics metrics = collector.finish();
 * </pre>
 *
 * <p>Not thread-safe; one collector per run.
 *
 * @see RunMetrics
 */
public final class RunMetricsCollector {

    private final Map<Phase, Long> phaseDurations = new EnumMap<>(Phase.class);

    private long runId;
    private String operation;
    private Instant startTime;
    private int migrationsProcessed;
    private int statementsExecuted;

    /**
     * Starts collection for a new run, discarding anything collected before.
     *
     * @return this collector for method chaining
     */
    public RunMetricsCollector start(long runId, String operation) {
        this.runId = runId;
        this.operation = operation;
        this.startTime = Instant.now();
        this.phaseDurations.clear();
        this.migrationsProcessed = 0;
        this.statementsExecuted = 0;
        return this;
    }

    @FunctionalInterface
    public interface ThrowingRunnable<E extends Exception> {
        void run() throws E;
    }

    @FunctionalInterface
    public interface ThrowingSupplier<T, E extends Exception> {
        T get() throws E;
    }

    /**
     * Time a phase and run the action. Repeated phases accumulate.
     */
    public <E extends Exception> void timed(Phase phase, ThrowingRunnable<E> action) throws E {
        long start = System.nanoTime();
        try {
            action.run();
        } finally {
            record(phase, start);
        }
    }

    /**
     * Time a phase and return the result. Repeated phases accumulate.
     */
    public <T, E extends Exception> T timed(Phase phase, ThrowingSupplier<T, E> action) throws E {
        long start = System.nanoTime();
        try {
            return action.get();
        } finally {
            record(phase, start);
        }
    }

    /**
     * Counts one applied or reverted file and its statements.
     *
     * @return this collector for method chaining
     */
    public RunMetricsCollector migrationProcessed(int statementCount) {
        migrationsProcessed++;
        statementsExecuted += statementCount;
        return this;
    }

    /**
     * Finishes collection and returns the metrics.
     *
     * @throws IllegalStateException if {@link #start(long, String)} was never called
     */
    public RunMetrics finish() {
        if (startTime == null) {
            throw new IllegalStateException("Collector not started");
        }
        Instant endTime = Instant.now();
        return new RunMetrics(
                runId,
                operation,
                startTime,
                endTime,
                phaseDurations,
                Duration.between(startTime, endTime).toMillis(),
                migrationsProcessed,
                statementsExecuted);
    }

    private void record(Phase phase, long startNanos) {
        long ms = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
        phaseDurations.merge(phase, ms, Long::sum);
    }
}
