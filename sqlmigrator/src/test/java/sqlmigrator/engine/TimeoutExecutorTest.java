package sqlmigrator.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import sqlmigrator.exceptions.MigrateException;
import sqlmigrator.exceptions.MigrationTimeoutException;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TimeoutExecutor")
class TimeoutExecutorTest {

    @Nested
    @DisplayName("executeWithTimeoutChecked (Callable)")
    class ExecuteCallable {

        @Test
        @DisplayName("should return result when operation completes within timeout")
        void shouldReturnResult() throws Exception {
            String result = TimeoutExecutor.executeWithTimeoutChecked(
                    "test", Duration.ofSeconds(5), () -> "success");

            assertThat(result).isEqualTo("success");
        }

        @Test
        @DisplayName("should throw MigrationTimeoutException when operation exceeds timeout")
        void shouldThrowOnTimeout() {
            assertThatThrownBy(() -> TimeoutExecutor.executeWithTimeoutChecked(
                    "slowOperation",
                    Duration.ofMillis(50),
                    () -> {
                        Thread.sleep(5000);
                        return "never";
                    }))
                    .isInstanceOf(MigrationTimeoutException.class)
                    .hasMessageContaining("slowOperation")
                    .hasMessageContaining("50 ms");
        }

        @Test
        @DisplayName("should propagate checked exception from callable")
        void shouldPropagateCheckedException() {
            MigrateException expected = new MigrateException("lock refused");

            assertThatThrownBy(() -> TimeoutExecutor.executeWithTimeoutChecked(
                    "test", Duration.ofSeconds(5), (Callable<String>) () -> {
                        throw expected;
                    }))
                    .isSameAs(expected);
        }

        @Test
        @DisplayName("should run on calling thread when timeout is disabled")
        void shouldRunOnCallingThreadWhenDisabled() throws Exception {
            Thread caller = Thread.currentThread();

            Thread used = TimeoutExecutor.executeWithTimeoutChecked(
                    "test", Duration.ZERO, (Callable<Thread>) Thread::currentThread);

            assertThat(used).isSameAs(caller);
        }

        @Test
        @DisplayName("should run on a daemon thread when timeout is enabled")
        void shouldRunOnDaemonThread() throws Exception {
            Thread used = TimeoutExecutor.executeWithTimeoutChecked(
                    "test", Duration.ofSeconds(5), (Callable<Thread>) Thread::currentThread);

            assertThat(used.isDaemon()).isTrue();
            assertThat(used.getName()).isEqualTo("migrator-timeout-executor");
        }
    }

    @Nested
    @DisplayName("executeWithTimeoutChecked (CheckedRunnable)")
    class ExecuteRunnable {

        @Test
        @DisplayName("should run the action")
        void shouldRunAction() throws Exception {
            AtomicBoolean ran = new AtomicBoolean();

            TimeoutExecutor.executeWithTimeoutChecked("test", Duration.ofSeconds(5), () -> ran.set(true));

            assertThat(ran).isTrue();
        }

        @Test
        @DisplayName("should run without timeout when timeout is null")
        void shouldRunWhenTimeoutNull() throws Exception {
            AtomicReference<String> seen = new AtomicReference<>();

            TimeoutExecutor.executeWithTimeoutChecked("test", null, () -> seen.set("ran"));

            assertThat(seen.get()).isEqualTo("ran");
        }
    }

    @Nested
    @DisplayName("late completion")
    class LateCompletion {

        @Test
        @DisplayName("should hand a result produced after the timeout to the late-result handler")
        void shouldHandLateResultToHandler() throws Exception {
            CountDownLatch handled = new CountDownLatch(1);
            AtomicReference<String> late = new AtomicReference<>();

            assertThatThrownBy(() -> TimeoutExecutor.executeWithTimeoutChecked(
                    "slowAcquire",
                    Duration.ofMillis(50),
                    () -> {
                        spinFor(Duration.ofMillis(300));
                        return "acquired";
                    },
                    result -> {
                        late.set(result);
                        handled.countDown();
                    }))
                    .isInstanceOf(MigrationTimeoutException.class);

            assertThat(handled.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(late.get()).isEqualTo("acquired");
        }

        @Test
        @DisplayName("should not call the handler when the operation finishes in time")
        void shouldNotCallHandlerWhenInTime() throws Exception {
            AtomicBoolean handled = new AtomicBoolean();

            TimeoutExecutor.executeWithTimeoutChecked("fast", Duration.ofSeconds(5),
                    () -> { }, () -> handled.set(true));

            assertThat(handled).isFalse();
        }

        @Test
        @DisplayName("should not call the handler when the abandoned operation fails")
        void shouldNotCallHandlerWhenAbandonedOperationFails() throws Exception {
            CountDownLatch finished = new CountDownLatch(1);
            AtomicBoolean handled = new AtomicBoolean();

            assertThatThrownBy(() -> TimeoutExecutor.executeWithTimeoutChecked(
                    "failingAcquire",
                    Duration.ofMillis(50),
                    () -> {
                        try {
                            spinFor(Duration.ofMillis(200));
                            throw new MigrateException("refused");
                        } finally {
                            finished.countDown();
                        }
                    },
                    () -> handled.set(true)))
                    .isInstanceOf(MigrationTimeoutException.class);

            assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
            Thread.sleep(100);
            assertThat(handled).isFalse();
        }
    }

    private static void spinFor(Duration duration) {
        long until = System.nanoTime() + duration.toNanos();
        while (System.nanoTime() < until) {
            Thread.onSpinWait();
        }
    }

    @Test
    @DisplayName("isEnabled should require a positive duration")
    void isEnabledShouldRequirePositive() {
        assertThat(TimeoutExecutor.isEnabled(Duration.ofMillis(1))).isTrue();
        assertThat(TimeoutExecutor.isEnabled(Duration.ZERO)).isFalse();
        assertThat(TimeoutExecutor.isEnabled(Duration.ofSeconds(-1))).isFalse();
        assertThat(TimeoutExecutor.isEnabled(null)).isFalse();
    }
}
