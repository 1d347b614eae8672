package sqlmigrator.validate;

import sqlmigrator.engine.MigrationWarning;

import java.util.List;

/**
 * Immutable validation outcome for a single migration file.
 *
 * <p>A file is valid when it has no errors; warnings never make it invalid.
 *
 * @param filename the validated file
 * @param version its version token
 * @param errors blocking problems, such as a missing up or down block
 * @param warnings non-blocking findings
 *
 * @see ValidationReport
 */
public record ValidationResult(
        String filename,
        String version,
        List<String> errors,
        List<MigrationWarning> warnings
) {
    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    /** Returns true if the file has no errors. */
    public boolean isValid() {
        return errors.isEmpty();
    }
}
