package org.carball.dpm.progress;

public class SilentProgressReporter implements ProgressReporter {

    @Override
    public void startTable(String tableName, int totalRows) {
    }

    @Override
    public void updateProgress(String tableName, int processedRows) {
    }

    @Override
    public void finishTable(String tableName) {
    }
}
