package sqlmigrator.file;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives version tokens and human names from migration filenames.
 *
 * <p>Filenames follow {@code YYYYMMDD[_HHMMSS]_<name>.sql}. The version is the
 * 8-digit date, joined with the 6-digit time by {@code _} when present.
 *
 * <p>Files and versions are ordered by plain string comparison. That matches
 * chronological order only because every version is a fixed-width, zero-padded
 * timestamp; a change of format must keep that property.
 */
public final class VersionCodec {

    private static final Pattern VERSION = Pattern.compile("^(\\d{8})(?:_(\\d{6}))?");
    private static final Pattern NAME = Pattern.compile("^\\d{8}(?:_\\d{6})?_(.+)\\.sql$");

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    public static final String SQL_SUFFIX = ".sql";

    private VersionCodec() {}

    /**
     * Extracts the version token from a filename.
     *
     * @param filename the bare filename
     * @return {@code 20251016_120000} or {@code 20251016}, or null when the prefix does not match
     */
    public static String extractVersion(String filename) {
        if (filename == null) return null;
        Matcher m = VERSION.matcher(filename);
        if (!m.find()) {
            return null;
        }
        return m.group(2) != null ? m.group(1) + "_" + m.group(2) : m.group(1);
    }

    /**
     * Extracts the human name: the part after the version, without {@code .sql},
     * underscores replaced by spaces. Falls back to the raw filename.
     */
    public static String extractName(String filename) {
        Matcher m = NAME.matcher(filename);
        return m.matches() ? m.group(1).replace('_', ' ') : filename;
    }

    /**
     * Returns true for {@code .sql} files carrying a version prefix.
     */
    public static boolean isMigrationFile(String filename) {
        return filename != null && filename.endsWith(SQL_SUFFIX) && extractVersion(filename) != null;
    }

    /**
     * Formats a local timestamp as a version token ({@code yyyyMMdd_HHmmss}).
     */
    public static String formatTimestamp(LocalDateTime time) {
        return TIMESTAMP.format(time);
    }
}
