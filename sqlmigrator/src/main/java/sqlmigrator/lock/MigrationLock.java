package sqlmigrator.lock;

import sqlmigrator.exceptions.MigrateException;

/**
 * Global advisory lock guarding the ledger and the target schema.
 *
 * <p>Single holder, process or cluster scope depending on the implementation
 * (a PostgreSQL advisory lock, for example). The orchestrator acquires it once
 * per mutating invocation and releases it in a {@code finally} block.
 *
 * <p>{@link #acquire()} may block; the orchestrator bounds the wait with the
 * configured lock timeout.
 */
public interface MigrationLock {

    /**
     * Blocks until the lock is held.
     *
     * @throws MigrateException if the lock cannot be acquired
     */
    void acquire() throws MigrateException;

    /**
     * Releases the lock.
     *
     * @throws MigrateException if the lock cannot be released
     */
    void release() throws MigrateException;
}
