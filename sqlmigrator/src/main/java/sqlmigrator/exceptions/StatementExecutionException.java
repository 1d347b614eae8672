package sqlmigrator.exceptions;

/**
 * Thrown when the transaction executor rejects a statement.
 *
 * <p>Executors raise it with the zero-based index of the first failing statement.
 * The orchestrator re-raises it with the version and filename filled in through
 * {@link #withContext(String, String, String)}.
 *
 * @see sqlmigrator.exec.TransactionExecutor
 */
public class StatementExecutionException extends MigrateException {

    /**
     * Creates an exception as raised by an executor.
     *
     * @param message description of the failure
     * @param statementIndex zero-based index of the failing statement
     * @param cause the driver-level cause (may be null)
     */
    public StatementExecutionException(String message, int statementIndex, Throwable cause) {
        super(message, null, null, statementIndex, null, cause);
    }

    public StatementExecutionException(String message,
                                       String version,
                                       String filename,
                                       int statementIndex,
                                       String stage,
                                       Throwable cause) {
        super(message, version, filename, statementIndex, stage, cause);
    }

    /**
     * Returns a copy of this exception carrying migration context.
     *
     * @param version the migration version being executed
     * @param filename the migration filename being executed
     * @param stage the orchestrator stage
     * @return a new exception with this one as its cause
     */
    public StatementExecutionException withContext(String version, String filename, String stage) {
        String base = getCause() != null && getCause().getMessage() != null
                ? "Statement execution failed: " + getCause().getMessage()
                : "Statement execution failed";
        return new StatementExecutionException(base, version, filename, getStatementIndex(), stage, this);
    }
}
