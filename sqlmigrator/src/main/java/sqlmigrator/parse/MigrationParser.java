package sqlmigrator.parse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sqlmigrator.file.ChecksumComputer;
import sqlmigrator.file.MigrationFile;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Extracts the up and down SQL blocks from a migration file.
 *
 * <p>Marker lines start with {@code -- Up Migration} or {@code -- Down Migration},
 * matched case-insensitively after leading blanks. Trailing text on a marker line
 * is allowed, e.g. {@code -- Down Migration (commented for safety)}: the line still
 * ends the up block, but the down block is only read after a bare down marker, so
 * such a file has no down block. A file with neither marker is a legacy file: its
 * whole content is the up block and it has no down block.
 *
 * <p>Lines whose trimmed form starts with a backslash are interactive-client
 * meta-commands (e.g. {@code \echo}). They are removed from every extracted block
 * so they never reach the {@link StatementSplitter}.
 */
public class MigrationParser {

    private static final Logger log = LoggerFactory.getLogger(MigrationParser.class);

    private static final Pattern UP_MARKER =
            Pattern.compile("^[ \\t]*-- Up Migration.*$", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    private static final Pattern DOWN_MARKER =
            Pattern.compile("^[ \\t]*-- Down Migration.*$", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    private static final Pattern BARE_DOWN_MARKER =
            Pattern.compile("^[ \\t]*-- Down Migration[ \\t]*\\r?$", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    /**
     * Returns true if the content has an up or a down marker line.
     */
    public static boolean hasMarkers(String content) {
        return UP_MARKER.matcher(content).find() || DOWN_MARKER.matcher(content).find();
    }

    /**
     * Parses a migration file into its tagged form.
     */
    public ParsedMigration parse(MigrationFile file) {
        ParsedMigration parsed = parse(file.content(), file.checksum());
        if (parsed.isLegacyFormat()) {
            log.debug("{} has no up/down markers, treating whole file as up migration", file.filename());
        }
        return parsed;
    }

    /**
     * Parses raw content; the checksum is computed over its UTF-8 bytes.
     */
    public ParsedMigration parse(String content) {
        return parse(content, ChecksumComputer.computeChecksum(content));
    }

    private ParsedMigration parse(String content, String checksum) {
        if (!hasMarkers(content)) {
            return new ParsedMigration.Legacy(clean(content), checksum);
        }
        return new ParsedMigration.Marked(
                clean(markedBlock(content, Direction.UP)),
                clean(markedBlock(content, Direction.DOWN)),
                checksum);
    }

    /**
     * Returns the cleaned, trimmed SQL for one direction.
     *
     * <p>Legacy files return the whole content for {@link Direction#UP} and an
     * empty string for {@link Direction#DOWN}.
     */
    public String extract(String content, Direction direction) {
        if (!hasMarkers(content)) {
            return direction == Direction.UP ? clean(content) : "";
        }
        return clean(markedBlock(content, direction));
    }

    private static String markedBlock(String content, Direction direction) {
        if (direction == Direction.UP) {
            Matcher up = UP_MARKER.matcher(content);
            if (!up.find()) {
                return "";
            }
            int start = up.end();
            Matcher down = DOWN_MARKER.matcher(content);
            int end = down.find(start) ? down.start() : content.length();
            return content.substring(start, end);
        }

        Matcher down = BARE_DOWN_MARKER.matcher(content);
        if (!down.find()) {
            return "";
        }
        return content.substring(down.end());
    }

    /**
     * Drops meta-command lines and trims the block.
     */
    static String clean(String sql) {
        return sql.lines()
                .filter(line -> !line.trim().startsWith("\\"))
                .collect(Collectors.joining("\n"))
                .trim();
    }
}
