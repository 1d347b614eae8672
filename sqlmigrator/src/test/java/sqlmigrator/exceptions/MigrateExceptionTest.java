package sqlmigrator.exceptions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import sqlmigrator.parse.Direction;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MigrateException")
class MigrateExceptionTest {

    @Nested
    @DisplayName("constructor with message only")
    class ConstructorWithMessageOnly {

        @Test
        @DisplayName("should store message")
        void shouldStoreMessage() {
            MigrateException ex = new MigrateException("Migration failed");

            assertThat(ex.getMessage()).isEqualTo("Migration failed");
        }

        @Test
        @DisplayName("should have no diagnostic fields")
        void shouldHaveNoDiagnosticFields() {
            MigrateException ex = new MigrateException("Error");

            assertThat(ex.getVersion()).isNull();
            assertThat(ex.getFilename()).isNull();
            assertThat(ex.getStage()).isNull();
            assertThat(ex.getStatementIndex()).isEqualTo(MigrateException.NO_STATEMENT);
            assertThat(ex.getCause()).isNull();
        }
    }

    @Nested
    @DisplayName("constructor with full diagnostics")
    class ConstructorWithDiagnostics {

        @Test
        @DisplayName("should append context to message")
        void shouldAppendContext() {
            MigrateException ex = new MigrateException("Boom", "20240101", "20240101_a.sql", 2, "apply", null);

            assertThat(ex.getMessage())
                    .isEqualTo("Boom [stage=apply] [version=20240101] [file=20240101_a.sql] [statement=2]");
        }

        @Test
        @DisplayName("should omit unset context")
        void shouldOmitUnsetContext() {
            MigrateException ex = new MigrateException("Boom", "20240101", null, MigrateException.NO_STATEMENT, null, null);

            assertThat(ex.getMessage()).isEqualTo("Boom [version=20240101]");
        }
    }

    @Nested
    @DisplayName("StatementExecutionException")
    class StatementExecution {

        @Test
        @DisplayName("withContext should keep index and chain the original")
        void withContextShouldKeepIndex() {
            SQLException driver = new SQLException("syntax error at or near \"TABLEE\"");
            StatementExecutionException raw = new StatementExecutionException("failed", 3, driver);

            StatementExecutionException ex = raw.withContext("20240101", "20240101_a.sql", "rollback");

            assertThat(ex.getStatementIndex()).isEqualTo(3);
            assertThat(ex.getVersion()).isEqualTo("20240101");
            assertThat(ex.getFilename()).isEqualTo("20240101_a.sql");
            assertThat(ex.getStage()).isEqualTo("rollback");
            assertThat(ex.getCause()).isSameAs(raw);
            assertThat(ex.getMessage()).startsWith("Statement execution failed: syntax error");
        }
    }

    @Test
    @DisplayName("typed exceptions should name what is missing")
    void typedExceptionsShouldDescribeFailure() {
        assertThat(new EmptyMigrationException(Direction.DOWN, "20240101", "20240101_a.sql", "rollback").getMessage())
                .startsWith("No DOWN migration found");
        assertThat(new VersionNotFoundException("20240101").getMessage())
                .contains("Version 20240101 not found in applied migrations");
        assertThat(new SourceFileMissingException("20240101").getMessage())
                .contains("Migration file not found for version: 20240101");
    }
}
