package sqlmigrator.engine;

import sqlmigrator.exceptions.MigrationTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs blocking operations under an optional timeout.
 *
 * <p>A null, zero or negative timeout disables protection and the operation runs
 * on the calling thread. Otherwise it is submitted to a shared daemon pool and the
 * caller waits at most {@code timeout}. On expiry the task is cancelled with an
 * interrupt and {@link MigrationTimeoutException} is raised; a task that ignores
 * the interrupt keeps running in the background. If such an abandoned task later
 * succeeds, its result goes to the late-result handler, so the caller can undo a
 * side effect it no longer owns (a lock acquired after the caller gave up).
 *
 * <p>Used by {@link MigrationOrchestrator} to bound lock acquisition.
 */
public final class TimeoutExecutor {

    private static final Logger log = LoggerFactory.getLogger(TimeoutExecutor.class);

    private static final ExecutorService EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "migrator-timeout-executor");
        t.setDaemon(true);
        return t;
    });

    private TimeoutExecutor() {}

    /**
     * Returns true if the timeout bounds the operation.
     */
    public static boolean isEnabled(Duration timeout) {
        return timeout != null && !timeout.isZero() && !timeout.isNegative();
    }

    /**
     * Calls {@code callable}, waiting at most {@code timeout} for its result.
     *
     * @param operation name used in log lines and the timeout message
     * @param timeout the bound, or null/zero to wait indefinitely
     * @param callable the operation
     * @return the callable's result
     * @throws MigrationTimeoutException if the bound expires or the caller is interrupted
     * @throws Exception whatever the callable throws, unwrapped
     */
    public static <T> T executeWithTimeoutChecked(String operation, Duration timeout, Callable<T> callable) throws Exception {
        return executeWithTimeoutChecked(operation, timeout, callable, null);
    }

    /**
     * Calls {@code callable}, waiting at most {@code timeout} for its result.
     * A result produced after the caller gave up is passed to {@code onLateResult}
     * on the pool thread; the handler's failures are logged.
     *
     * @param onLateResult receives results the caller never saw, may be null
     */
    public static <T> T executeWithTimeoutChecked(String operation,
                                                  Duration timeout,
                                                  Callable<T> callable,
                                                  LateResultHandler<? super T> onLateResult) throws Exception {
        if (!isEnabled(timeout)) {
            return callable.call();
        }

        log.debug("Executing '{}' with timeout of {} ms", operation, timeout.toMillis());

        // whoever flips this first owns the result: the waiting caller, or the task's late handler
        AtomicBoolean claimed = new AtomicBoolean();
        AtomicReference<T> produced = new AtomicReference<>();

        Future<T> future = EXECUTOR.submit(() -> {
            T result = callable.call();
            produced.set(result);
            if (!claimed.compareAndSet(false, true)) {
                Thread.interrupted(); // clear the cancel interrupt
                handleLateResult(operation, result, onLateResult);
            }
            return result;
        });

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            if (!claimed.compareAndSet(false, true)) {
                // finished between the wait expiring and the cancel
                return produced.get();
            }
            log.warn("Operation '{}' timed out after {} ms", operation, timeout.toMillis());
            throw new MigrationTimeoutException(operation, timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            if (!claimed.compareAndSet(false, true)) {
                return produced.get();
            }
            throw new MigrationTimeoutException(operation, timeout, e);
        } catch (ExecutionException e) {
            throw unwrap(operation, e.getCause());
        }
    }

    /**
     * Void form of {@link #executeWithTimeoutChecked(String, Duration, Callable)}.
     */
    public static void executeWithTimeoutChecked(String operation, Duration timeout, CheckedRunnable action) throws Exception {
        executeWithTimeoutChecked(operation, timeout, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Void form with a hook for an action that completes after the caller gave up.
     */
    public static void executeWithTimeoutChecked(String operation,
                                                 Duration timeout,
                                                 CheckedRunnable action,
                                                 CheckedRunnable onLateCompletion) throws Exception {
        executeWithTimeoutChecked(operation, timeout, () -> {
            action.run();
            return null;
        }, ignored -> onLateCompletion.run());
    }

    private static <T> void handleLateResult(String operation, T result, LateResultHandler<? super T> handler) {
        if (handler == null) {
            log.warn("Operation '{}' completed after its timeout; result discarded", operation);
            return;
        }
        log.warn("Operation '{}' completed after its timeout; running late-result handler", operation);
        try {
            handler.accept(result);
        } catch (Exception e) {
            log.error("Late-result handler for '{}' failed", operation, e);
        }
    }

    private static Exception unwrap(String operation, Throwable cause) {
        if (cause instanceof Error error) {
            throw error;
        }
        if (cause instanceof Exception exception) {
            return exception;
        }
        return new IllegalStateException("Operation '" + operation + "' failed", cause);
    }

    /**
     * Receives the result of an operation the caller stopped waiting for.
     */
    @FunctionalInterface
    public interface LateResultHandler<T> {
        void accept(T result) throws Exception;
    }

    /**
     * A runnable that can throw checked exceptions.
     */
    @FunctionalInterface
    public interface CheckedRunnable {
        void run() throws Exception;
    }
}
