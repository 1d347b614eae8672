package sqlmigrator.config;

/**
 * Alert level for run event logging.
 *
 * <p>Controls the minimum severity of events that get logged by
 * {@link sqlmigrator.alert.MigrationAlertLogger}. Configured via the
 * {@code migrator.alert.level} property or the {@code --verbose} CLI flag.
 *
 * <ul>
 *   <li>{@link #DEBUG} - Run started/completed, each applied or reverted file, warnings, errors</li>
 *   <li>{@link #WARNING} - Legacy-format warnings, lock release failures and errors</li>
 *   <li>{@link #ERROR} - Run failures and lock timeouts only</li>
 * </ul>
 *
 * @see MigratorConfig#alertLevel()
 */
public enum AlertLevel {
    /** Log every run event. Use for development and troubleshooting. */
    DEBUG,

    /** Log warnings and errors only. Default. */
    WARNING,

    /** Log errors only. */
    ERROR
}
