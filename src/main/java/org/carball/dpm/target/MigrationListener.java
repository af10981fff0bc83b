package org.carball.dpm.target;

/**
 * Notified once the target store holds the full schema and data, e.g. to publish
 * release notes for the converted database.
 */
@FunctionalInterface
public interface MigrationListener {

    void onMigrated(MigrationSummary summary);
}
