package sqlmigrator.engine;

/**
 * The mutating operations the orchestrator runs under the migration lock.
 */
public enum Operation {
    /** Apply every file whose version is not in the ledger, oldest first. */
    APPLY_ALL_PENDING,
    /** Revert the most recently applied migration. */
    ROLLBACK_ONE,
    /** Revert every migration applied after a target version, newest first. */
    ROLLBACK_TO_VERSION
}
