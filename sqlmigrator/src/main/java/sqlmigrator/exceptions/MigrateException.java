package sqlmigrator.exceptions;

/**
 * Exception thrown when a migration operation fails.
 *
 * <p>This exception provides diagnostic context so a failed run can be
 * understood without re-running it in verbose mode:
 * <ul>
 *   <li>A human-readable error message</li>
 *   <li>The migration version and filename involved</li>
 *   <li>The zero-based index of the failing statement, when known</li>
 *   <li>The stage where failure occurred (e.g. {@code apply}, {@code rollback}, {@code lock})</li>
 * </ul>
 *
 * <p>Context values that are not set are omitted from {@link #getMessage()}.
 *
 * @see sqlmigrator.engine.MigrationOrchestrator
 */
public class MigrateException extends Exception {

    /** Marker for "no statement index available". */
    public static final int NO_STATEMENT = -1;

    private final String version;
    private final String filename;
    private final int statementIndex;
    private final String stage;

    // ---------------- constructors ----------------

    /**
     * Creates a new migration exception with a message.
     *
     * @param message the error message
     */
    public MigrateException(String message) {
        this(message, null, null, NO_STATEMENT, null, null);
    }

    /**
     * Creates a new migration exception with a message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public MigrateException(String message, Throwable cause) {
        this(message, null, null, NO_STATEMENT, null, cause);
    }

    /**
     * Creates a new migration exception with full diagnostic context.
     *
     * @param message the error message
     * @param version the migration version involved (may be null)
     * @param filename the migration filename involved (may be null)
     * @param statementIndex zero-based index of the failing statement, or {@link #NO_STATEMENT}
     * @param stage the stage where failure occurred (may be null)
     * @param cause the underlying cause (may be null)
     */
    public MigrateException(String message,
                            String version,
                            String filename,
                            int statementIndex,
                            String stage,
                            Throwable cause) {
        super(message, cause);
        this.version = version;
        this.filename = filename;
        this.statementIndex = statementIndex;
        this.stage = stage;
    }

    // ---------------- getters ----------------

    /**
     * Returns the migration version involved in the failure.
     *
     * @return the version, or null if not set
     */
    public String getVersion() {
        return version;
    }

    /**
     * Returns the migration filename involved in the failure.
     *
     * @return the filename, or null if not set
     */
    public String getFilename() {
        return filename;
    }

    /**
     * Returns the zero-based index of the failing statement.
     *
     * @return the statement index, or {@link #NO_STATEMENT} if not applicable
     */
    public int getStatementIndex() {
        return statementIndex;
    }

    /**
     * Returns the stage where the failure occurred.
     *
     * @return the stage name, or null if not set
     */
    public String getStage() {
        return stage;
    }

    // ---------------- diagnostics ----------------

    @Override
    public String getMessage() {
        String base = super.getMessage();
        StringBuilder sb = new StringBuilder(base == null ? "" : base);

        if (stage != null) sb.append(" [stage=").append(stage).append("]");
        if (version != null) sb.append(" [version=").append(version).append("]");
        if (filename != null) sb.append(" [file=").append(filename).append("]");
        if (statementIndex != NO_STATEMENT) sb.append(" [statement=").append(statementIndex).append("]");

        return sb.toString();
    }
}
