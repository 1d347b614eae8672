package sqlmigrator.status;

import sqlmigrator.file.MigrationFile;
import sqlmigrator.ledger.AppliedRecord;

import java.util.List;

/**
 * Snapshot of the catalog against the ledger.
 *
 * @param fileCount migration files on disk
 * @param applied ledger records, oldest first
 * @param pending files not yet applied, in catalog order
 * @param drifted applied records whose file changed since it was applied
 * @param orphaned applied records with no file on disk
 */
public record StatusReport(
        int fileCount,
        List<AppliedRecord> applied,
        List<MigrationFile> pending,
        List<AppliedRecord> drifted,
        List<AppliedRecord> orphaned
) {
    public StatusReport {
        applied = List.copyOf(applied);
        pending = List.copyOf(pending);
        drifted = List.copyOf(drifted);
        orphaned = List.copyOf(orphaned);
    }

    /** Returns true if nothing is pending and nothing drifted or went missing. */
    public boolean isClean() {
        return pending.isEmpty() && drifted.isEmpty() && orphaned.isEmpty();
    }
}
