package sqlmigrator.ledger;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of the applied-migrations ledger.
 *
 * <p>Owned by the {@link MigrationLedger}; the engine only reads it.
 *
 * @param version migration version token
 * @param name human-readable migration name
 * @param appliedAt when the migration was recorded (may be null if the store does not keep it)
 * @param executionTimeMs time spent executing the up block (may be null)
 * @param checksum SHA-256 of the file at apply time (may be null for records written by older tools)
 */
public record AppliedRecord(
        String version,
        String name,
        Instant appliedAt,
        Long executionTimeMs,
        String checksum
) {
    public AppliedRecord {
        Objects.requireNonNull(version, "version");
    }
}
