package org.carball.dpm.progress;

import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;

@Slf4j
public class LoggingProgressReporter implements ProgressReporter {

    private final Map<String, Integer> tableTotals = new HashMap<>();

    @Override
    public void startTable(String tableName, int totalRows) {
        tableTotals.put(tableName, totalRows);
        log.info("Processing table: {} ({} rows)", tableName, totalRows);
    }

    @Override
    public void updateProgress(String tableName, int processedRows) {
        int total = tableTotals.getOrDefault(tableName, 0);
        if (total > 0) {
            log.debug("Table {}: {}/{} rows ({})", tableName, processedRows, total,
                    String.format("%.1f%%", processedRows * 100.0 / total));
        }
    }

    @Override
    public void finishTable(String tableName) {
        Integer total = tableTotals.remove(tableName);
        log.info("Completed table: {} ({} rows)", tableName, total == null ? 0 : total);
    }
}
