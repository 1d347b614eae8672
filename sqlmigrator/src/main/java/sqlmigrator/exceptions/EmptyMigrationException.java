package sqlmigrator.exceptions;

import sqlmigrator.parse.Direction;

/**
 * Thrown when the SQL block needed for a direction is blank.
 *
 * <p>For {@link Direction#UP} this is an empty up migration; for
 * {@link Direction#DOWN} it means the file has no down migration to roll back with.
 */
public class EmptyMigrationException extends MigrateException {

    private final Direction direction;

    public EmptyMigrationException(Direction direction, String version, String filename, String stage) {
        super("No " + direction + " migration found", version, filename, NO_STATEMENT, stage, null);
        this.direction = direction;
    }

    /** Returns the direction whose block was empty. */
    public Direction getDirection() {
        return direction;
    }
}
