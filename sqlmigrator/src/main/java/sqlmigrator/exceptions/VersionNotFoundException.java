package sqlmigrator.exceptions;

/**
 * Thrown when a rollback target version is not among the applied migrations.
 *
 * <p>Raised while resolving the rollback set, before any mutation happens.
 */
public class VersionNotFoundException extends MigrateException {

    public VersionNotFoundException(String version) {
        super("Version " + version + " not found in applied migrations",
                version, null, NO_STATEMENT, "resolve", null);
    }
}
