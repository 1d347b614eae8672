package sqlmigrator.parse;

/**
 * Direction in which a migration file is executed.
 */
public enum Direction {
    /** Forward schema change, applied when moving to a newer version. */
    UP,
    /** Reverse schema change, applied when rolling a version back. */
    DOWN
}
