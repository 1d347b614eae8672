package sqlmigrator.exec;

import sqlmigrator.exceptions.StatementExecutionException;

import java.util.List;

/**
 * Executes the statements of one migration file inside one transaction.
 *
 * <p>Statements run sequentially in the given order. Explicit {@code BEGIN;} ...
 * {@code COMMIT;} blocks produced by the {@link sqlmigrator.parse.StatementSplitter}
 * arrive as single statements; honouring them is up to the implementation.
 *
 * <p>Implementations stop at the first failing statement, roll back and raise
 * {@link StatementExecutionException} with that statement's zero-based index.
 */
@FunctionalInterface
public interface TransactionExecutor {

    /**
     * Runs all statements in one transaction.
     *
     * @param statements ordered, non-empty statements
     * @throws StatementExecutionException on the first failing statement
     */
    void runInTransaction(List<String> statements) throws StatementExecutionException;
}
