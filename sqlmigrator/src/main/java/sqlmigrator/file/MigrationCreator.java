package sqlmigrator.file;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sqlmigrator.exceptions.MigrateException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Objects;

/**
 * Writes new, timestamped migration files from the standard template.
 *
 * <p>The file is named {@code <yyyyMMdd_HHmmss>_<name>.sql}, where the name is
 * lower-cased and every character outside {@code [a-z0-9]} becomes {@code _}.
 * The template carries both markers, each followed by an empty transaction block.
 */
public class MigrationCreator {

    private static final Logger log = LoggerFactory.getLogger(MigrationCreator.class);

    private final Path directory;
    private final Clock clock;

    public MigrationCreator(Path directory, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public MigrationCreator(Path directory) {
        this(directory, Clock.systemDefaultZone());
    }

    /**
     * Creates a new migration file.
     *
     * @param name free-form migration name
     * @return path of the written file
     * @throws IllegalArgumentException if the name is blank
     * @throws MigrateException if the file already exists or cannot be written
     */
    public Path create(String name) throws MigrateException {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Migration name is required");
        }

        String timestamp = VersionCodec.formatTimestamp(LocalDateTime.now(clock));
        String filename = timestamp + "_" + sanitize(name) + VersionCodec.SQL_SUFFIX;
        Path target = directory.resolve(filename);

        try {
            Files.createDirectories(directory);
            Files.writeString(target, template(name), StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
        } catch (FileAlreadyExistsException e) {
            throw new MigrateException("Migration file already exists",
                    timestamp, filename, MigrateException.NO_STATEMENT, "create", e);
        } catch (IOException e) {
            throw new MigrateException("Failed to write migration file: " + e.getMessage(),
                    timestamp, filename, MigrateException.NO_STATEMENT, "create", e);
        }

        log.info("Migration created: {}", target);
        return target;
    }

    static String sanitize(String name) {
        return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "_");
    }

    String template(String name) {
        String description = name.replace('_', ' ');
        return "-- Migration: " + description + "\n"
                + "-- Created: " + clock.instant() + "\n"
                + "\n"
                + "-- Up Migration\n"
                + "BEGIN;\n"
                + "\n"
                + "-- Add your UP migration SQL here\n"
                + "-- Example:\n"
                + "-- CREATE TABLE example_table (\n"
                + "--     id UUID PRIMARY KEY DEFAULT gen_random_uuid(),\n"
                + "--     name VARCHAR(255) NOT NULL,\n"
                + "--     created_at TIMESTAMP DEFAULT NOW()\n"
                + "-- );\n"
                + "\n"
                + "COMMIT;\n"
                + "\n"
                + "-- Down Migration\n"
                + "BEGIN;\n"
                + "\n"
                + "-- Add your DOWN migration SQL here\n"
                + "-- Example:\n"
                + "-- DROP TABLE IF EXISTS example_table;\n"
                + "\n"
                + "COMMIT;\n";
    }
}
