package org.carball.dpm.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.dpm.model.schema.LogicalType;

import javax.lang.model.SourceVersion;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Slf4j
public class ConversionConfig {

    @JsonProperty("patterns")
    private ColumnPatterns patterns = new ColumnPatterns();

    // Exact column names whose physical type is known to be misleading
    @JsonProperty("column_type_overrides")
    private Map<String, LogicalType> columnTypeOverrides = new LinkedHashMap<>(Map.of(
            "ParentFirst", LogicalType.BOOLEAN,
            "UseIntervalArithmetics", LogicalType.BOOLEAN,
            "StartDate", LogicalType.DATETIME,
            "EndDate", LogicalType.DATETIME));

    // Linking columns the source only declares by convention, as column -> Table.Column
    @JsonProperty("foreign_key_mappings")
    private Map<String, String> foreignKeyMappings = new LinkedHashMap<>(Map.of(
            "RowGUID", "Concept.ConceptGUID",
            "ParentItemID", "Item.ItemID"));

    @JsonProperty("identity_column")
    private String identityColumn = "RowGUID";

    @JsonProperty("hub_table")
    private String hubTable = "Concept";

    @JsonProperty("relation_name_overrides")
    private Map<String, String> relationNameOverrides = new LinkedHashMap<>(Map.of("RowGUID", "RowConcept"));

    @JsonProperty("source_extensions")
    private List<String> sourceExtensions = new ArrayList<>(List.of("accdb", "mdb"));

    @JsonProperty("preferred_database_keyword")
    private String preferredDatabaseKeyword = "dpm";

    @JsonProperty("ignored_table_prefixes")
    private List<String> ignoredTablePrefixes = new ArrayList<>(List.of("MSys", "~", "sqlite_"));

    @JsonProperty("target_file_name")
    private String targetFileName = "dpm.sqlite";

    @JsonProperty("batch_size")
    private int batchSize = 50_000;

    @JsonProperty("without_rowid")
    private boolean withoutRowid = true;

    @JsonProperty("model_package")
    private String modelPackage = "eu.dpm.model";

    @JsonProperty("model_class_name")
    private String modelClassName = "Dpm";

    public static ConversionConfig createDefaults() {
        return new ConversionConfig();
    }

    /**
     * Rejects settings the pipeline cannot run with and logs warnings for suspicious ones.
     */
    public void validate() {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive but was " + batchSize);
        }
        if (targetFileName == null || targetFileName.isBlank()) {
            throw new IllegalArgumentException("Target file name must not be empty");
        }
        if (modelClassName == null || !SourceVersion.isName(modelClassName)) {
            throw new IllegalArgumentException("Model class name is not a valid Java identifier: " + modelClassName);
        }
        if (modelPackage != null && !modelPackage.isEmpty() && !SourceVersion.isName(modelPackage)) {
            throw new IllegalArgumentException("Model package is not a valid Java package name: " + modelPackage);
        }
        if (sourceExtensions.isEmpty()) {
            log.warn("No source extensions configured; directory sources will never match");
        }
        if (batchSize < 100) {
            log.warn("Batch size {} is very small and will slow down loading", batchSize);
        }
        if (hubTable == null || hubTable.isBlank()) {
            log.warn("No hub table configured; all model references will be direct");
        }
        log.debug("Using configuration: {}", getDescription());
    }

    @JsonIgnore
    public String getDescription() {
        return String.format(
                "target=%s, batchSize=%d, hub=%s, identity=%s, model=%s.%s, overrides=%d, augmentedKeys=%d",
                targetFileName, batchSize, hubTable, identityColumn, modelPackage, modelClassName,
                columnTypeOverrides.size(), foreignKeyMappings.size());
    }
}
