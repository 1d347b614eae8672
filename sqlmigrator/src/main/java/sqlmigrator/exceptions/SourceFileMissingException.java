package sqlmigrator.exceptions;

/**
 * Thrown when an applied version has no migration file on disk.
 *
 * <p>This indicates the ledger and the migrations directory disagree. It is raised
 * before any mutation, so nothing has been rolled back when it surfaces.
 */
public class SourceFileMissingException extends MigrateException {

    public SourceFileMissingException(String version) {
        super("Migration file not found for version: " + version,
                version, null, NO_STATEMENT, "resolve", null);
    }
}
