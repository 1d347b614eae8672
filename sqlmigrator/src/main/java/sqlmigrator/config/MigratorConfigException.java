package sqlmigrator.config;

/**
 * Thrown when migrator configuration cannot be loaded or is invalid.
 *
 * <p>Cases:
 * <ul>
 *   <li>No configuration file on the classpath (strict {@link MigratorConfigLoader#load()})</li>
 *   <li>A file that cannot be parsed as properties or YAML</li>
 *   <li>A builder value out of range, such as a negative lock timeout</li>
 * </ul>
 *
 * <p>Unchecked, so configuration loading can sit in startup code without
 * forced handling.
 *
 * @see MigratorConfigLoader
 */
public class MigratorConfigException extends RuntimeException {

    public MigratorConfigException(String message) {
        super(message);
    }

    public MigratorConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
