package sqlmigrator.parse;

import java.util.Objects;

/**
 * Result of parsing one migration file: either a {@link Marked} file with
 * explicit up and down blocks, or a {@link Legacy} file whose whole content is
 * the up migration.
 *
 * <p>The shape is decided once by {@link MigrationParser}; callers use the
 * uniform accessors instead of re-checking the file format.
 */
public sealed interface ParsedMigration permits ParsedMigration.Marked, ParsedMigration.Legacy {

    /** Cleaned, trimmed up SQL. Never null, may be empty. */
    String upSql();

    /** Cleaned, trimmed down SQL. Empty for legacy files. */
    String downSql();

    /** SHA-256 of the raw file bytes. */
    String checksum();

    /** True if the file carries no up/down markers. */
    boolean isLegacyFormat();

    /**
     * Returns the SQL block for a direction.
     */
    default String sql(Direction direction) {
        return direction == Direction.UP ? upSql() : downSql();
    }

    /**
     * File with {@code -- Up Migration} and/or {@code -- Down Migration} markers.
     *
     * <p>An empty {@code downSql} here is a validation error, unlike a legacy file.
     */
    record Marked(String upSql, String downSql, String checksum) implements ParsedMigration {
        public Marked {
            Objects.requireNonNull(upSql, "upSql");
            Objects.requireNonNull(downSql, "downSql");
        }

        @Override
        public boolean isLegacyFormat() {
            return false;
        }
    }

    /**
     * File without markers; the whole content is the up migration and there is no reverse.
     */
    record Legacy(String upSql, String checksum) implements ParsedMigration {
        public Legacy {
            Objects.requireNonNull(upSql, "upSql");
        }

        @Override
        public String downSql() {
            return "";
        }

        @Override
        public boolean isLegacyFormat() {
            return true;
        }
    }
}
