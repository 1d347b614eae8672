package sqlmigrator.engine;

import java.util.Objects;

/**
 * A non-fatal finding reported alongside a run or validation.
 *
 * @param kind what was found
 * @param version the file's version token (may be null)
 * @param filename the file concerned
 * @param message human-readable description
 */
public record MigrationWarning(Kind kind, String version, String filename, String message) {

    public enum Kind {
        /** File has no direction markers; its whole content is the up block. */
        LEGACY_FORMAT,
        /** An up or down block lacks an explicit BEGIN; / COMMIT; pair. */
        MISSING_TRANSACTION_BLOCK
    }

    public MigrationWarning {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public static MigrationWarning legacyFormat(String version, String filename) {
        return new MigrationWarning(Kind.LEGACY_FORMAT, version, filename,
                "Legacy format (no -- Up Migration / -- Down Migration markers); rollback not supported");
    }

    public static MigrationWarning missingTransactionBlock(String version, String filename, String block) {
        return new MigrationWarning(Kind.MISSING_TRANSACTION_BLOCK, version, filename,
                block + " migration missing BEGIN/COMMIT transaction block");
    }
}
