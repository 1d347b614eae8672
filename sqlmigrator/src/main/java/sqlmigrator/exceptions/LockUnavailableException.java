package sqlmigrator.exceptions;

/**
 * Thrown when the global migration lock cannot be acquired, either because the
 * lock primitive failed or because acquisition timed out.
 *
 * <p>No mutation is attempted once this is raised.
 */
public class LockUnavailableException extends MigrateException {

    public LockUnavailableException(String message, Throwable cause) {
        super(message, null, null, NO_STATEMENT, "lock", cause);
    }
}
