package sqlmigrator.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Central configuration for migrator runs.
 *
 * <p>Holds:
 * <ul>
 *   <li>The migrations directory</li>
 *   <li>The lock wait timeout and the advisory lock key</li>
 *   <li>The alert level</li>
 *   <li>Datasource coordinates, read only by database bindings such as the example runner</li>
 * </ul>
 *
 * <p>Loaded from {@code migrator.properties} or {@code migrator.yml} by
 * {@link MigratorConfigLoader}.
 *
 * @see MigratorConfigLoader
 */
public final class MigratorConfig {

    public static final String DEFAULT_DIRECTORY = "migrations";
    public static final String DEFAULT_LOCK_KEY = "migration_lock";

    public static final MigratorConfig DEFAULTS = builder().build();

    private final Path directory;
    private final Duration lockTimeout;
    private final String lockKey;
    private final AlertLevel alertLevel;
    private final String datasourceUrl;
    private final String datasourceUser;
    private final String datasourcePassword;

    private MigratorConfig(Builder b) {
        this.directory = b.directory;
        this.lockTimeout = b.lockTimeout;
        this.lockKey = b.lockKey;
        this.alertLevel = b.alertLevel;
        this.datasourceUrl = b.datasourceUrl;
        this.datasourceUser = b.datasourceUser;
        this.datasourcePassword = b.datasourcePassword;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns the directory holding the migration files. */
    public Path directory() { return directory; }

    /** Returns how long to wait for the migration lock; zero means wait indefinitely. */
    public Duration lockTimeout() { return lockTimeout; }

    /** Returns the advisory lock key name. */
    public String lockKey() { return lockKey; }

    /** Returns the alert level for run event logging. */
    public AlertLevel alertLevel() { return alertLevel; }

    /** Returns the JDBC URL, or null if not configured. */
    public String datasourceUrl() { return datasourceUrl; }

    /** Returns the database user, or null if not configured. */
    public String datasourceUser() { return datasourceUser; }

    /** Returns the database password, or null if not configured. */
    public String datasourcePassword() { return datasourcePassword; }

    /**
     * Returns a builder pre-populated with this configuration's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .directory(directory)
                .lockTimeout(lockTimeout)
                .lockKey(lockKey)
                .alertLevel(alertLevel)
                .datasourceUrl(datasourceUrl)
                .datasourceUser(datasourceUser)
                .datasourcePassword(datasourcePassword);
    }

    @Override
    public String toString() {
        return "MigratorConfig{" +
                "directory=" + directory +
                ", lockTimeout=" + lockTimeout.toSeconds() + "s" +
                ", lockKey=" + lockKey +
                ", alertLevel=" + alertLevel +
                ", datasourceUrl=" + datasourceUrl +
                ", datasourceUser=" + datasourceUser +
                '}';
    }

    /**
     * Builder for {@link MigratorConfig} instances.
     */
    public static final class Builder {
        private Path directory = Path.of(DEFAULT_DIRECTORY);
        private Duration lockTimeout = Duration.ZERO;
        private String lockKey = DEFAULT_LOCK_KEY;
        private AlertLevel alertLevel = AlertLevel.WARNING;
        private String datasourceUrl;
        private String datasourceUser;
        private String datasourcePassword;

        public Builder directory(Path directory) {
            this.directory = Objects.requireNonNull(directory, "directory");
            return this;
        }

        public Builder directory(String directory) {
            return directory(Path.of(directory));
        }

        public Builder lockTimeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isNegative()) {
                throw new MigratorConfigException("lockTimeout must not be negative: " + timeout);
            }
            this.lockTimeout = timeout;
            return this;
        }

        public Builder lockTimeoutSeconds(long seconds) {
            return lockTimeout(seconds > 0 ? Duration.ofSeconds(seconds) : Duration.ZERO);
        }

        public Builder lockKey(String lockKey) {
            if (lockKey == null || lockKey.isBlank()) {
                throw new MigratorConfigException("lockKey must not be blank");
            }
            this.lockKey = lockKey;
            return this;
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = Objects.requireNonNull(level, "level");
            return this;
        }

        public Builder datasourceUrl(String url) {
            this.datasourceUrl = url;
            return this;
        }

        public Builder datasourceUser(String user) {
            this.datasourceUser = user;
            return this;
        }

        public Builder datasourcePassword(String password) {
            this.datasourcePassword = password;
            return this;
        }

        public MigratorConfig build() {
            return new MigratorConfig(this);
        }
    }
}
