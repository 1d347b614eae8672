package sqlmigrator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Loads migrator configuration from properties or YAML files.
 *
 * <p>Search order on the classpath:
 * <ol>
 *   <li>{@code migrator.properties}</li>
 *   <li>{@code migrator.yml}</li>
 * </ol>
 *
 * <p>System properties override file values under the same names
 * (e.g. {@code -Dmigrator.directory=db/migrations}).
 *
 * <h2>Properties:</h2>
 * <ul>
 *   <li>{@code migrator.directory} - migrations directory</li>
 *   <li>{@code migrator.lock.timeout} - lock wait in seconds, 0 waits indefinitely</li>
 *   <li>{@code migrator.lock.key} - advisory lock key name</li>
 *   <li>{@code migrator.alert.level} - DEBUG, WARNING, or ERROR</li>
 *   <li>{@code migrator.datasource.url}, {@code .user}, {@code .password} - JDBC coordinates</li>
 * </ul>
 *
 * <p>Invalid numeric or enum values are logged and ignored.
 *
 * @see MigratorConfig
 */
public final class MigratorConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(MigratorConfigLoader.class);

    static final String PROPERTIES_RESOURCE = "migrator.properties";
    static final String YAML_RESOURCE = "migrator.yml";

    private MigratorConfigLoader() {}

    /**
     * Load from classpath (migrator.properties or migrator.yml).
     * @throws MigratorConfigException if no config file found
     */
    public static MigratorConfig load() {
        return loadFromClasspath().orElseThrow(() -> new MigratorConfigException(
                "Config file required: " + PROPERTIES_RESOURCE + " or " + YAML_RESOURCE));
    }

    /**
     * Load from classpath, falling back to defaults plus system-property
     * overrides when no config file is present.
     */
    public static MigratorConfig loadOrDefaults() {
        return loadFromClasspath().orElseGet(() -> {
            log.debug("No {} or {} on classpath, using defaults", PROPERTIES_RESOURCE, YAML_RESOURCE);
            return parse(new Properties());
        });
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws MigratorConfigException if the configuration is invalid
     */
    public static MigratorConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    private static Optional<MigratorConfig> loadFromClasspath() {
        InputStream props = getResource(PROPERTIES_RESOURCE);
        if (props != null) {
            try (props) {
                return Optional.of(loadProperties(props, PROPERTIES_RESOURCE));
            } catch (IOException e) {
                throw new MigratorConfigException("Failed to close " + PROPERTIES_RESOURCE, e);
            }
        }

        InputStream yaml = getResource(YAML_RESOURCE);
        if (yaml != null) {
            try (yaml) {
                return Optional.of(loadYaml(yaml, YAML_RESOURCE));
            } catch (IOException e) {
                throw new MigratorConfigException("Failed to close " + YAML_RESOURCE, e);
            }
        }
        return Optional.empty();
    }

    private static InputStream getResource(String name) {
        return MigratorConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static MigratorConfig loadProperties(InputStream is, String source) {
        try {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded config from {}", source);
            return parse(props);
        } catch (IOException | IllegalArgumentException e) {
            throw new MigratorConfigException("Failed to load " + source, e);
        }
    }

    private static MigratorConfig loadYaml(InputStream is, String source) {
        Object root;
        try {
            root = new Yaml().load(is);
        } catch (YAMLException e) {
            throw new MigratorConfigException("Failed to parse " + source, e);
        }
        Properties props = new Properties();
        if (root instanceof Map) {
            flatten("", asMap(root), props);
        } else if (root != null) {
            throw new MigratorConfigException(source + " must contain a mapping at the top level");
        }
        log.info("Loaded config from {}", source);
        return parse(props);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object o) {
        return (Map<String, Object>) o;
    }

    private static void flatten(String prefix, Map<String, Object> map, Properties props) {
        for (var entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, asMap(val), props);
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    static MigratorConfig parse(Properties props) {
        MigratorConfig.Builder b = MigratorConfig.builder();

        getString(props, "migrator.directory")
                .filter(v -> !v.isEmpty())
                .ifPresent(b::directory);

        getLong(props, "migrator.lock.timeout").ifPresent(v -> {
            if (v < 0) {
                log.warn("Negative lock.timeout ignored: {}", v);
            } else {
                b.lockTimeoutSeconds(v);
            }
        });

        getString(props, "migrator.lock.key")
                .filter(v -> !v.isEmpty())
                .ifPresent(b::lockKey);

        getString(props, "migrator.alert.level").ifPresent(v -> {
            try {
                b.alertLevel(AlertLevel.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid alert.level: {}", v);
            }
        });

        getString(props, "migrator.datasource.url").ifPresent(b::datasourceUrl);
        getString(props, "migrator.datasource.user").ifPresent(b::datasourceUser);
        // password is not trimmed
        String password = System.getProperty("migrator.datasource.password",
                props.getProperty("migrator.datasource.password"));
        if (password != null) b.datasourcePassword(password);

        return b.build();
    }

    private static Optional<String> getString(Properties props, String key) {
        String val = System.getProperty(key);
        if (val == null) val = props.getProperty(key);
        return val != null ? Optional.of(val.trim()) : Optional.empty();
    }

    private static Optional<Long> getLong(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Long.parseLong(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }
}
