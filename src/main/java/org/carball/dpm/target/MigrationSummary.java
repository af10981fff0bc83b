package org.carball.dpm.target;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Outcome of loading the target store.
 *
 * @param rowsLoaded   rows committed per table, in load order
 * @param skippedTables tables created empty because their rows could not be inserted
 */
public record MigrationSummary(Path target,
                               List<String> tablesCreated,
                               Map<String, Integer> rowsLoaded,
                               List<String> skippedTables) {

    public long totalRows() {
        return rowsLoaded.values().stream().mapToLong(Integer::longValue).sum();
    }
}
