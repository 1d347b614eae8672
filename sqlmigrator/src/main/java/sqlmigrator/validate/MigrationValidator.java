package sqlmigrator.validate;

import sqlmigrator.engine.MigrationWarning;
import sqlmigrator.file.MigrationFile;
import sqlmigrator.parse.MigrationParser;
import sqlmigrator.parse.ParsedMigration;
import sqlmigrator.parse.StatementSplitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Checks migration files for structural problems without touching a database.
 *
 * <p>Every file is checked; a problem in one does not stop the others.
 *
 * <h2>Errors:</h2>
 * <ul>
 *   <li>Empty up block</li>
 *   <li>Empty down block in a file with markers</li>
 * </ul>
 *
 * <h2>Warnings:</h2>
 * <ul>
 *   <li>Legacy format (no markers, so no rollback)</li>
 *   <li>Up or down block without an explicit {@code BEGIN;} / {@code COMMIT;} pair</li>
 * </ul>
 */
public class MigrationValidator {

    private static final Logger log = LoggerFactory.getLogger(MigrationValidator.class);

    static final String NO_UP = "No UP migration found";
    static final String NO_DOWN = "No DOWN migration found";

    private final MigrationParser parser;

    public MigrationValidator() {
        this(new MigrationParser());
    }

    public MigrationValidator(MigrationParser parser) {
        this.parser = parser;
    }

    /**
     * Validates the given files.
     *
     * @param files files in catalog order
     * @return a report with one result per file
     */
    public ValidationReport validate(List<MigrationFile> files) {
        List<ValidationResult> results = new ArrayList<>();
        for (MigrationFile file : files) {
            results.add(validate(file));
        }
        boolean success = results.stream().allMatch(ValidationResult::isValid);
        return new ValidationReport(success, Collections.unmodifiableList(results));
    }

    /**
     * Validates one file.
     */
    public ValidationResult validate(MigrationFile file) {
        ParsedMigration parsed = parser.parse(file);
        List<String> errors = new ArrayList<>();
        List<MigrationWarning> warnings = new ArrayList<>();

        String up = parsed.upSql();
        String down = parsed.downSql();

        if (up.isEmpty()) {
            errors.add(NO_UP);
        } else if (!StatementSplitter.hasTransactionBlock(up)) {
            warnings.add(MigrationWarning.missingTransactionBlock(file.version(), file.filename(), "UP"));
        }

        if (parsed.isLegacyFormat()) {
            warnings.add(MigrationWarning.legacyFormat(file.version(), file.filename()));
        } else if (down.isEmpty()) {
            errors.add(NO_DOWN);
        } else if (!StatementSplitter.hasTransactionBlock(down)) {
            warnings.add(MigrationWarning.missingTransactionBlock(file.version(), file.filename(), "DOWN"));
        }

        log.debug("Validated {}: {} errors, {} warnings", file.filename(), errors.size(), warnings.size());
        return new ValidationResult(file.filename(), file.version(), errors, warnings);
    }
}
