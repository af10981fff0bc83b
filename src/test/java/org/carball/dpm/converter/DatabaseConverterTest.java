package org.carball.dpm.converter;

import org.carball.dpm.SqliteFixtures;
import org.carball.dpm.config.ConversionConfig;
import org.carball.dpm.exception.DatabaseNotFoundException;
import org.carball.dpm.exception.TargetConflictException;
import org.carball.dpm.model.schema.Column;
import org.carball.dpm.model.schema.Table;
import org.carball.dpm.progress.SilentProgressReporter;
import org.carball.dpm.source.TableExtractor;
import org.carball.dpm.target.MigrationSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DatabaseConverterTest {

    @TempDir
    Path tempDir;

    private Path source;
    private Path target;
    private DatabaseConverter converter;

    @BeforeEach
    void setUp() throws Exception {
        source = SqliteFixtures.createCategoryItemDatabase(tempDir.resolve("source.sqlite"));
        target = tempDir.resolve("out");
        converter = new DatabaseConverter(ConversionConfig.createDefaults(), new SilentProgressReporter());
    }

    @Test
    public void shouldConvertSourceIntoStoreAndModel() throws Exception {
        // Given
        List<MigrationSummary> notified = new ArrayList<>();
        converter.addListener(notified::add);

        // When
        ConversionResult result = converter.convert(request(false, false));

        // Then
        assertThat(result.order().tables()).containsExactly("Category", "Item");
        assertThat(result.rowsScanned()).containsEntry("Category", 1).containsEntry("Item", 1);
        assertThat(result.failedExtractions()).isEmpty();

        Table item = result.schema().getTable("Item");
        assertThat(item.findColumn("ParentItemID").map(Column::isNullable)).contains(true);
        assertThat(item.findColumn("CategoryGUID").map(Column::isNullable)).contains(false);
        assertThat(result.schema().getTable("Category").findColumn("CategoryType").orElseThrow().getEnumDomain())
                .containsExactly("Metric");

        Path store = target.resolve("dpm.sqlite");
        assertThat(result.migration().target()).isEqualTo(store);
        assertThat(notified).containsExactly(result.migration());
        List<Map<String, Object>> items = SqliteFixtures.query(store, "SELECT ItemID, CategoryGUID FROM Item");
        assertThat(items).hasSize(1);
        assertThat(items.get(0)).containsEntry("ItemID", 1).containsEntry("CategoryGUID", "c-1");

        String model = Files.readString(result.modelFile());
        assertThat(result.modelFile()).isEqualTo(target.resolve("Dpm.java"));
        assertThat(model).contains("private Item self;");
        assertThat(model).contains("private Category category;");
        assertThat(model).contains("private List<Item> items = new ArrayList<>();");
        assertThat(model).contains("public enum CategoryType {");
    }

    @Test
    public void shouldOnlyWriteModelInModelOnlyMode() throws Exception {
        // Given
        List<MigrationSummary> notified = new ArrayList<>();
        converter.addListener(notified::add);

        // When
        ConversionResult result = converter.convert(request(false, true));

        // Then
        assertThat(result.isModelOnly()).isTrue();
        assertThat(result.migration()).isNull();
        assertThat(Files.exists(target.resolve("dpm.sqlite"))).isFalse();
        assertThat(Files.exists(result.modelFile())).isTrue();
        assertThat(notified).isEmpty();
    }

    @Test
    public void shouldRefuseExistingStoreBeforeWritingAnything() throws Exception {
        // Given
        Files.createDirectories(target);
        Path store = Files.writeString(target.resolve("dpm.sqlite"), "previous run");

        // When / Then
        assertThatThrownBy(() -> converter.convert(request(false, false)))
                .isInstanceOf(TargetConflictException.class);
        assertThat(Files.readString(store)).isEqualTo("previous run");
        assertThat(Files.exists(target.resolve("Dpm.java"))).isFalse();
    }

    @Test
    public void shouldReplaceExistingStoreWhenOverwriting() throws Exception {
        // Given
        Files.createDirectories(target);
        Files.writeString(target.resolve("dpm.sqlite"), "previous run");

        // When
        ConversionResult result = converter.convert(request(true, false));

        // Then
        assertThat(result.migration().totalRows()).isEqualTo(2);
        assertThat(SqliteFixtures.query(result.migration().target(), "SELECT COUNT(*) AS n FROM Category").get(0))
                .containsEntry("n", 1);
    }

    @Test
    public void shouldProduceSameModelOnRepeatedRuns() throws Exception {
        // When
        String first = Files.readString(converter.convert(request(false, true)).modelFile());
        String second = Files.readString(converter.convert(request(false, true)).modelFile());

        // Then
        assertThat(second).isEqualTo(first);
    }

    @Test
    public void shouldKeepTableWithoutDataWhenItsExtractionFails() throws Exception {
        // Given
        TableExtractor failingForCategory = new TableExtractor() {
            @Override
            public List<Map<String, Object>> readRows(Connection connection, Table table) throws SQLException {
                if (table.getName().equals("Category")) {
                    throw new SQLException("Category is locked");
                }
                return super.readRows(connection, table);
            }
        };
        converter = new DatabaseConverter(ConversionConfig.createDefaults(), new SilentProgressReporter(),
                failingForCategory);

        // When
        ConversionResult result = converter.convert(request(false, false));

        // Then
        assertThat(result.failedExtractions()).containsExactly("Category");
        assertThat(result.rowsScanned()).containsOnlyKeys("Item");
        assertThat(result.schema().getTable("Category").findColumn("CategoryType").orElseThrow().isEnumerated())
                .isFalse();

        Path store = result.migration().target();
        assertThat(result.migration().tablesCreated()).containsExactly("Category", "Item");
        assertThat(result.migration().rowsLoaded()).containsOnlyKeys("Item");
        assertThat(SqliteFixtures.query(store, "SELECT COUNT(*) AS n FROM Category").get(0)).containsEntry("n", 0);
        assertThat(SqliteFixtures.query(store, "SELECT ItemID FROM Item")).hasSize(1);

        String model = Files.readString(result.modelFile());
        assertThat(model).contains("public static class Category {");
        assertThat(model).contains("private Category category;");
    }

    @Test
    public void shouldFailWhenSourceIsMissing() {
        // Given
        ConversionRequest request = request(false, false);
        request.setSource(tempDir.resolve("missing"));

        // When / Then
        assertThatThrownBy(() -> converter.convert(request))
                .isInstanceOf(DatabaseNotFoundException.class);
        assertThat(Files.exists(target)).isFalse();
    }

    private ConversionRequest request(boolean overwrite, boolean modelOnly) {
        ConversionRequest request = new ConversionRequest();
        request.setSource(source);
        request.setTargetDirectory(target);
        request.setOverwrite(overwrite);
        request.setModelOnly(modelOnly);
        return request;
    }
}
