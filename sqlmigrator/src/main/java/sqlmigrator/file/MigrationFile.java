package sqlmigrator.file;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable migration file read from disk.
 *
 * <p>Version and name are derived from the filename by {@link VersionCodec};
 * they are never stored anywhere else. The raw bytes are kept as read so the
 * checksum covers the exact file content.
 *
 * @see FileCatalog
 */
public final class MigrationFile {

    private final Path path;
    private final String filename;
    private final String version;
    private final String name;
    private final byte[] rawContent;

    /**
     * Creates a migration file from already-read content.
     *
     * @param path location of the file
     * @param rawContent the exact file bytes
     * @throws IllegalArgumentException if the filename carries no version
     */
    public MigrationFile(Path path, byte[] rawContent) {
        this.path = Objects.requireNonNull(path, "path");
        this.filename = path.getFileName().toString();
        this.version = VersionCodec.extractVersion(filename);
        if (version == null) {
            throw new IllegalArgumentException("Not a migration file: " + filename);
        }
        this.name = VersionCodec.extractName(filename);
        this.rawContent = Objects.requireNonNull(rawContent, "rawContent").clone();
    }

    /**
     * Reads a migration file from disk.
     *
     * @param path the file to read
     * @return the migration file
     * @throws IOException if the file cannot be read
     */
    public static MigrationFile read(Path path) throws IOException {
        return new MigrationFile(path, Files.readAllBytes(path));
    }

    public Path path() { return path; }

    public String filename() { return filename; }

    public String version() { return version; }

    public String name() { return name; }

    /** Returns the file content decoded as UTF-8. */
    public String content() {
        return new String(rawContent, StandardCharsets.UTF_8);
    }

    /** Returns the SHA-256 checksum of the raw bytes. */
    public String checksum() {
        return ChecksumComputer.computeChecksum(rawContent);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MigrationFile other)) return false;
        return path.equals(other.path) && Arrays.equals(rawContent, other.rawContent);
    }

    @Override
    public int hashCode() {
        return 31 * path.hashCode() + Arrays.hashCode(rawContent);
    }

    @Override
    public String toString() {
        return "MigrationFile{" + filename + ", version=" + version + '}';
    }
}
