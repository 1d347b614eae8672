package sqlmigrator.plan;

import sqlmigrator.exceptions.VersionNotFoundException;
import sqlmigrator.file.MigrationFile;
import sqlmigrator.ledger.AppliedRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Diffs the file catalog against the applied ledger.
 *
 * <p>Provides:
 * <ul>
 *   <li>The pending set: catalog files whose version is not applied, in catalog order</li>
 *   <li>The rollback set for a target version: records applied after it, newest first</li>
 *   <li>The last applied record, for single-step rollback</li>
 *   <li>Drifted and orphaned records, for status reporting</li>
 * </ul>
 *
 * <p>Applied records are expected in application order, which equals filename
 * order because versions are zero-padded timestamps.
 *
 * @see sqlmigrator.engine.MigrationOrchestrator
 */
public final class ReconciliationEngine {

    private ReconciliationEngine() {}

    // ===== apply =====

    /**
     * Returns catalog files whose version is not in {@code appliedVersions}.
     *
     * @param catalog files in filename order
     * @param appliedVersions versions already applied
     * @return pending files, preserving catalog order
     */
    public static List<MigrationFile> pending(List<MigrationFile> catalog, Set<String> appliedVersions) {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(appliedVersions, "appliedVersions");

        List<MigrationFile> result = new ArrayList<>();
        for (MigrationFile f : catalog) {
            if (!appliedVersions.contains(f.version())) {
                result.add(f);
            }
        }
        return List.copyOf(result);
    }

    /**
     * Returns the versions of the given records, in order.
     */
    public static Set<String> appliedVersions(List<AppliedRecord> applied) {
        Set<String> versions = new LinkedHashSet<>();
        for (AppliedRecord r : applied) {
            versions.add(r.version());
        }
        return versions;
    }

    // ===== rollback =====

    /**
     * Returns the records applied strictly after {@code targetVersion}, most recent first.
     *
     * <p>An empty result means the ledger is already at the target.
     *
     * @param applied records in application order
     * @param targetVersion the version to roll back to (it stays applied)
     * @return the records to roll back, latest first
     * @throws VersionNotFoundException if the target was never applied
     */
    public static List<AppliedRecord> rollbackTarget(List<AppliedRecord> applied, String targetVersion)
            throws VersionNotFoundException {

        Objects.requireNonNull(applied, "applied");

        int targetIndex = -1;
        for (int i = 0; i < applied.size(); i++) {
            if (applied.get(i).version().equals(targetVersion)) {
                targetIndex = i;
                break;
            }
        }
        if (targetIndex == -1) {
            throw new VersionNotFoundException(targetVersion);
        }

        List<AppliedRecord> result = new ArrayList<>(applied.subList(targetIndex + 1, applied.size()));
        Collections.reverse(result);
        return List.copyOf(result);
    }

    /**
     * Returns the most recently applied record.
     *
     * @return the last record, or null if nothing is applied
     */
    public static AppliedRecord lastApplied(List<AppliedRecord> applied) {
        return applied.isEmpty() ? null : applied.get(applied.size() - 1);
    }

    // ===== status =====

    /**
     * Returns applied records whose stored checksum no longer matches the file on disk.
     *
     * <p>Records without a stored checksum, and records without a file, are skipped.
     */
    public static List<AppliedRecord> drifted(List<MigrationFile> catalog, List<AppliedRecord> applied) {
        Map<String, MigrationFile> byVersion = indexByVersion(catalog);

        List<AppliedRecord> result = new ArrayList<>();
        for (AppliedRecord r : applied) {
            MigrationFile f = byVersion.get(r.version());
            if (f == null || r.checksum() == null) continue;
            if (!r.checksum().equals(f.checksum())) {
                result.add(r);
            }
        }
        return List.copyOf(result);
    }

    /**
     * Returns applied records that have no migration file on disk.
     */
    public static List<AppliedRecord> orphaned(List<MigrationFile> catalog, List<AppliedRecord> applied) {
        Map<String, MigrationFile> byVersion = indexByVersion(catalog);

        List<AppliedRecord> result = new ArrayList<>();
        for (AppliedRecord r : applied) {
            if (!byVersion.containsKey(r.version())) {
                result.add(r);
            }
        }
        return List.copyOf(result);
    }

    private static Map<String, MigrationFile> indexByVersion(List<MigrationFile> catalog) {
        Map<String, MigrationFile> byVersion = new HashMap<>();
        for (MigrationFile f : catalog) {
            // first file in filename order wins, same as FileCatalog.findByVersion
            byVersion.putIfAbsent(f.version(), f);
        }
        return byVersion;
    }
}
