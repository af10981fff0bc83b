package org.carball.dpm.progress;

/**
 * Receives per-table progress while rows are loaded into the target store.
 */
public interface ProgressReporter {

    void startTable(String tableName, int totalRows);

    void updateProgress(String tableName, int processedRows);

    void finishTable(String tableName);
}
