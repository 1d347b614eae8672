package sqlmigrator.exceptions;

import java.time.Duration;

/**
 * Raised by {@link sqlmigrator.engine.TimeoutExecutor} when a bounded call does
 * not finish in time. The orchestrator only bounds lock acquisition and reports
 * this as a {@link LockUnavailableException}.
 *
 * <p>Unchecked, so the bounded call keeps its own throws clause.
 */
public class MigrationTimeoutException extends RuntimeException {

    private final String operation;
    private final Duration timeout;

    public MigrationTimeoutException(String operation, Duration timeout) {
        this(operation, timeout, null);
    }

    /**
     * @param operation name of the bounded call, e.g. {@code lockAcquire}
     * @param timeout the bound that expired
     * @param cause the {@code TimeoutException} or {@code InterruptedException}, may be null
     */
    public MigrationTimeoutException(String operation, Duration timeout, Throwable cause) {
        super("Operation '" + operation + "' timed out after " + timeout.toMillis() + " ms", cause);
        this.operation = operation;
        this.timeout = timeout;
    }

    public String getOperation() {
        return operation;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
