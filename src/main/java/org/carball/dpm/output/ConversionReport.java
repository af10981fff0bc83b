package org.carball.dpm.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.dpm.converter.ConversionResult;
import org.carball.dpm.exception.ConversionException;
import org.carball.dpm.model.schema.Column;
import org.carball.dpm.model.schema.Table;
import org.carball.dpm.target.MigrationSummary;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
public class ConversionReport {

    private final ConversionResult result;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public ConversionReport(ConversionResult result) {
        this.result = result;
        this.timestamp = LocalDateTime.now();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new ConversionException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();
        MigrationSummary migration = result.migration();

        md.append("# DPM Conversion Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Source:** `").append(result.sourceDatabase()).append("`  \n");
        if (migration != null) {
            md.append("**Target:** `").append(migration.target()).append("`  \n");
        }
        md.append("**Model:** `").append(result.modelFile()).append("`  \n\n");

        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Tables | ").append(result.schema().size()).append(" |\n");
        md.append("| Foreign Keys | ").append(countForeignKeys(false)).append(" |\n");
        md.append("| Augmented Foreign Keys | ").append(countForeignKeys(true)).append(" |\n");
        md.append("| Rows Loaded | ").append(migration == null ? "-" : String.valueOf(migration.totalRows())).append(" |\n");
        md.append("| Scan Time | ").append(result.scanDuration().toMillis()).append(" ms |\n");
        md.append("| Total Time | ").append(result.totalDuration().toMillis()).append(" ms |\n\n");

        md.append("## Tables\n\n");
        md.append("| Table | Columns | Enumerated | Nullable | Rows |\n");
        md.append("|-------|---------|------------|----------|------|\n");
        for (String name : result.order().tables()) {
            Table table = result.schema().getTable(name);
            md.append("| ").append(name)
                    .append(" | ").append(table.getColumns().size())
                    .append(" | ").append(table.getColumns().stream().filter(Column::isEnumerated).count())
                    .append(" | ").append(table.getColumns().stream().filter(Column::isNullable).count())
                    .append(" | ").append(rowsOf(name))
                    .append(" |\n");
        }
        md.append("\n");

        List<String> skipped = skippedTables();
        if (!skipped.isEmpty()) {
            md.append("## Skipped Data\n\n");
            md.append("These tables were created without rows:\n\n");
            skipped.forEach(t -> md.append("- ").append(t).append("\n"));
            md.append("\n");
        }

        if (result.order().hasCycles()) {
            md.append("## Dependency Cycles\n\n");
            result.order().advisories().forEach(a -> md.append("- ").append(a).append("\n"));
            md.append("\n");
        }

        md.append("---\n\n");
        md.append("*Generated by dpm-convert*\n");
        return md.toString();
    }

    private ReportData buildReportData() {
        ReportData report = new ReportData();
        MigrationSummary migration = result.migration();

        report.setMetadata(new RunMetadata(
                timestamp,
                result.sourceDatabase().toString(),
                migration == null ? null : migration.target().toString(),
                result.modelFile().toString(),
                result.scanDuration().toMillis(),
                result.totalDuration().toMillis()));

        report.setTables(result.order().tables().stream()
                .map(name -> {
                    Table table = result.schema().getTable(name);
                    TableEntry entry = new TableEntry();
                    entry.setName(name);
                    entry.setPrimaryKey(table.getPrimaryKey());
                    entry.setColumns(table.getColumns().size());
                    entry.setEnumeratedColumns(table.getColumns().stream()
                            .filter(Column::isEnumerated)
                            .map(Column::getName)
                            .collect(Collectors.toList()));
                    entry.setForeignKeys(table.foreignKeyColumns().stream()
                            .map(c -> c.getName() + " -> " + c.getForeignKey())
                            .collect(Collectors.toList()));
                    entry.setRowsScanned(result.rowsScanned().get(name));
                    entry.setRowsLoaded(migration == null ? null : migration.rowsLoaded().getOrDefault(name, 0));
                    return entry;
                })
                .collect(Collectors.toList()));

        report.setSkippedTables(skippedTables());
        report.setAdvisories(result.order().advisories());
        return report;
    }

    private List<String> skippedTables() {
        List<String> skipped = new ArrayList<>(result.failedExtractions());
        if (result.migration() != null) {
            result.migration().skippedTables().stream()
                    .filter(t -> !skipped.contains(t))
                    .forEach(skipped::add);
        }
        return skipped;
    }

    private String rowsOf(String table) {
        if (result.migration() != null) {
            return String.valueOf(result.migration().rowsLoaded().getOrDefault(table, 0));
        }
        Integer scanned = result.rowsScanned().get(table);
        return scanned == null ? "-" : String.valueOf(scanned);
    }

    private long countForeignKeys(boolean augmented) {
        return result.schema().getTables().stream()
                .flatMap(t -> t.foreignKeyColumns().stream())
                .filter(c -> c.getForeignKey().augmented() == augmented)
                .count();
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private RunMetadata metadata;
        private List<TableEntry> tables;
        private List<String> skippedTables;
        private List<String> advisories;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class RunMetadata {
        private LocalDateTime timestamp;
        private String source;
        private String target;
        private String modelFile;
        private long scanMillis;
        private long totalMillis;
    }

    @lombok.Data
    private static class TableEntry {
        private String name;
        private List<String> primaryKey;
        private int columns;
        private List<String> enumeratedColumns;
        private List<String> foreignKeys;
        private Integer rowsScanned;
        private Integer rowsLoaded;
    }
}
