package org.carball.dpm.converter;

import org.carball.dpm.model.schema.DatabaseSchema;
import org.carball.dpm.target.MigrationSummary;
import org.carball.dpm.transform.TableOrder;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Everything a run produced. {@code migration} is null for model-only runs.
 */
public record ConversionResult(
        Path sourceDatabase,
        DatabaseSchema schema,
        TableOrder order,
        Map<String, Integer> rowsScanned,
        List<String> failedExtractions,
        Path modelFile,
        MigrationSummary migration,
        Instant startedAt,
        Duration scanDuration,
        Duration totalDuration
) {

    public boolean isModelOnly() {
        return migration == null;
    }
}
