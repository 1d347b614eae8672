package sqlmigrator.engine;

import sqlmigrator.parse.Direction;

/**
 * One file applied or reverted during a run.
 *
 * @param version the migration version
 * @param name the migration name
 * @param direction UP when applied, DOWN when reverted
 * @param executionTimeMs wall-clock time spent in the executor
 * @param statementCount statements handed to the executor
 */
public record ExecutedMigration(
        String version,
        String name,
        Direction direction,
        long executionTimeMs,
        int statementCount
) {}
