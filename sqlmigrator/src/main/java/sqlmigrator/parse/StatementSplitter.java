package sqlmigrator.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Splits a cleaned SQL block into individually executable statements.
 *
 * <p>A single forward scan over lines, folding into an accumulator with a
 * two-state machine:
 * <ul>
 *   <li>{@code BEGIN;} opens a transaction block; the accumulator is not flushed
 *       until the matching {@code COMMIT;} or {@code ROLLBACK;}</li>
 *   <li>outside a block, a line ending in {@code ;} closes the current statement</li>
 *   <li>any other line is accumulated with its newline</li>
 * </ul>
 * Whatever remains after the last line becomes a final statement. A transaction
 * block is therefore always handed to the executor as one unit.
 *
 * <p>Lines are compared trimmed and case-insensitively but accumulated as written.
 */
public class StatementSplitter {

    enum State {
        NORMAL,
        IN_TRANSACTION_BLOCK
    }

    private static final String BEGIN = "BEGIN;";
    private static final String COMMIT = "COMMIT;";
    private static final String ROLLBACK = "ROLLBACK;";

    /**
     * Splits SQL text into statements.
     *
     * @param sql cleaned SQL block (meta-commands already removed)
     * @return ordered, trimmed, non-empty statements
     */
    public List<String> split(String sql) {
        List<String> statements = new ArrayList<>();
        if (sql == null || sql.isBlank()) {
            return statements;
        }

        StringBuilder current = new StringBuilder();
        State state = State.NORMAL;

        for (String line : sql.split("\\r?\\n", -1)) {
            String trimmed = line.trim().toUpperCase(Locale.ROOT);

            if (trimmed.equals(BEGIN)) {
                current.append(line).append('\n');
                state = State.IN_TRANSACTION_BLOCK;
            } else if (trimmed.equals(COMMIT) || trimmed.equals(ROLLBACK)) {
                current.append(line).append('\n');
                if (state == State.IN_TRANSACTION_BLOCK) {
                    flush(current, statements);
                    state = State.NORMAL;
                }
            } else if (trimmed.endsWith(";") && state == State.NORMAL) {
                current.append(line);
                flush(current, statements);
            } else {
                current.append(line).append('\n');
            }
        }

        flush(current, statements);
        return statements;
    }

    private static void flush(StringBuilder current, List<String> statements) {
        String statement = current.toString().trim();
        if (!statement.isEmpty()) {
            statements.add(statement);
        }
        current.setLength(0);
    }

    /**
     * Returns true if the SQL contains a {@code BEGIN;} line and a {@code COMMIT;} line.
     */
    public static boolean hasTransactionBlock(String sql) {
        boolean begin = false;
        boolean commit = false;
        for (String line : sql.split("\\r?\\n")) {
            String trimmed = line.trim().toUpperCase(Locale.ROOT);
            if (trimmed.equals(BEGIN)) begin = true;
            else if (trimmed.equals(COMMIT)) commit = true;
        }
        return begin && commit;
    }
}
