package sqlmigrator.validate;

import java.util.List;

/**
 * Immutable report of all validated migration files.
 *
 * <p>The report is successful only if every contained {@link ValidationResult}
 * is valid.
 *
 * @see MigrationValidator
 */
public final class ValidationReport {
    private final boolean success;
    private final List<ValidationResult> results;

    /**
     * @param success true if no file has errors
     * @param results per-file results in catalog order
     */
    public ValidationReport(boolean success, List<ValidationResult> results) {
        this.success = success;
        this.results = List.copyOf(results);
    }

    /** Returns true if no file has errors. */
    public boolean success() { return success; }

    /** Returns the per-file results, in catalog order. */
    public List<ValidationResult> results() { return results; }

    /** Returns the total number of errors across all files. */
    public int errorCount() {
        return results.stream().mapToInt(r -> r.errors().size()).sum();
    }

    /** Returns the total number of warnings across all files. */
    public int warningCount() {
        return results.stream().mapToInt(r -> r.warnings().size()).sum();
    }
}
