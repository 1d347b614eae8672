package sqlmigrator.ledger;

import sqlmigrator.exceptions.MigrateException;

import java.util.List;

/**
 * Durable record of which migration versions have been applied.
 *
 * <p>The ledger is the only state that survives between runs. Implementations
 * own the storage (a database table, typically); the engine reads it fresh on
 * every invocation and never caches it.
 *
 * <p>All mutating calls happen while the {@link sqlmigrator.lock.MigrationLock} is held.
 *
 * @see AppliedRecord
 */
public interface MigrationLedger {

    /**
     * Returns applied records in application order (oldest first).
     *
     * @throws MigrateException if the ledger cannot be read
     */
    List<AppliedRecord> getApplied() throws MigrateException;

    /**
     * Records a successfully applied migration.
     *
     * @param version the migration version
     * @param name the migration name
     * @param executionTimeMs time spent executing the up block
     * @param checksum SHA-256 of the migration file
     * @throws MigrateException if the record cannot be written
     */
    void record(String version, String name, long executionTimeMs, String checksum) throws MigrateException;

    /**
     * Removes the record of a rolled-back migration.
     *
     * @param version the migration version
     * @throws MigrateException if the record cannot be removed
     */
    void remove(String version) throws MigrateException;
}
