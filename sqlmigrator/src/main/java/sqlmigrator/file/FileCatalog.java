package sqlmigrator.file;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Enumerates migration files in a directory.
 *
 * <p>Only regular {@code .sql} files with a version prefix are listed; anything
 * else is skipped without error. The result is sorted by filename in plain
 * string order, which is chronological for the timestamp-based versions.
 *
 * <p>Every call reads the directory again; nothing is cached between runs.
 */
public class FileCatalog {

    private static final Logger log = LoggerFactory.getLogger(FileCatalog.class);

    private final Path directory;

    public FileCatalog(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    /** The directory this catalog reads. */
    public Path directory() {
        return directory;
    }

    /**
     * Lists migration files sorted by filename.
     *
     * <p>A missing directory is created and yields an empty list.
     *
     * @return the migration files in ascending filename order
     * @throws IOException if the directory cannot be listed or a file cannot be read
     */
    public List<MigrationFile> list() throws IOException {
        if (!Files.isDirectory(directory)) {
            log.info("Creating migrations directory: {}", directory);
            Files.createDirectories(directory);
            return List.of();
        }

        List<Path> candidates;
        try (Stream<Path> entries = Files.list(directory)) {
            candidates = entries
                    .filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        }

        List<MigrationFile> files = new ArrayList<>(candidates.size());
        for (Path p : candidates) {
            String filename = p.getFileName().toString();
            if (!VersionCodec.isMigrationFile(filename)) {
                log.debug("Skipping {}: not a migration file", filename);
                continue;
            }
            files.add(MigrationFile.read(p));
        }
        return files;
    }

    /**
     * Finds the migration file carrying the given version in an already-listed catalog.
     *
     * @param files the catalog, in filename order
     * @param version the version to look up
     * @return the first matching file in filename order, or null if none matches
     */
    public static MigrationFile findByVersion(List<MigrationFile> files, String version) {
        for (MigrationFile f : files) {
            if (f.version().equals(version)) {
                return f;
            }
        }
        return null;
    }
}
