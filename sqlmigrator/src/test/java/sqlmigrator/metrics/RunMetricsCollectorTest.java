package sqlmigrator.metrics;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sqlmigrator.metrics.RunMetrics.Phase;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RunMetricsCollector")
class RunMetricsCollectorTest {

    private RunMetricsCollector collector;

    @BeforeEach
    void setUp() {
        collector = new RunMetricsCollector();
    }

    @Test
    @DisplayName("should count migrations and statements")
    void shouldCountMigrationsAndStatements() {
        collector.start(7, "APPLY_ALL_PENDING");
        collector.migrationProcessed(2).migrationProcessed(3);

        RunMetrics m = collector.finish();

        assertThat(m.runId()).isEqualTo(7);
        assertThat(m.operation()).isEqualTo("APPLY_ALL_PENDING");
        assertThat(m.migrationsProcessed()).isEqualTo(2);
        assertThat(m.statementsExecuted()).isEqualTo(5);
        assertThat(m.endTime()).isAfterOrEqualTo(m.startTime());
    }

    @Test
    @DisplayName("should time phases and return supplier result")
    void shouldTimePhases() throws Exception {
        collector.start(1, "ROLLBACK_ONE");

        String value = collector.timed(Phase.RESOLVE, () -> "resolved");
        collector.timed(Phase.EXECUTE, () -> Thread.sleep(20));
        collector.timed(Phase.EXECUTE, () -> Thread.sleep(20));

        RunMetrics m = collector.finish();
        assertThat(value).isEqualTo("resolved");
        assertThat(m.phaseDurations()).containsKeys(Phase.RESOLVE, Phase.EXECUTE);
        assertThat(m.phaseDuration(Phase.EXECUTE)).isGreaterThanOrEqualTo(40);
        assertThat(m.phaseDuration(Phase.LOCK)).isZero();
    }

    @Test
    @DisplayName("should record phase time when action throws")
    void shouldRecordPhaseOnFailure() {
        collector.start(1, "APPLY_ALL_PENDING");

        assertThatThrownBy(() -> collector.timed(Phase.EXECUTE, () -> {
            throw new IOException("disk");
        })).isInstanceOf(IOException.class);

        assertThat(collector.finish().phaseDurations()).containsKey(Phase.EXECUTE);
    }

    @Test
    @DisplayName("start should reset previous run")
    void startShouldReset() {
        collector.start(1, "A").migrationProcessed(4);

        RunMetrics m = collector.start(2, "B").finish();

        assertThat(m.migrationsProcessed()).isZero();
        assertThat(m.statementsExecuted()).isZero();
    }

    @Test
    @DisplayName("finish should fail when not started")
    void finishShouldFailWhenNotStarted() {
        assertThatThrownBy(() -> collector.finish()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("summary and map should expose counts")
    void summaryAndMapShouldExposeCounts() {
        RunMetrics m = collector.start(3, "ROLLBACK_TO_VERSION").migrationProcessed(1).finish();

        assertThat(m.summary()).startsWith("Run #3 ROLLBACK_TO_VERSION").contains("1 migrations, 1 statements");
        Map<String, Object> map = m.toMap();
        assertThat(map).containsEntry("runId", 3L).containsEntry("migrationsProcessed", 1);
    }
}
