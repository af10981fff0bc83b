package org.carball.dpm.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.dpm.SqliteFixtures;
import org.carball.dpm.config.ConversionConfig;
import org.carball.dpm.converter.ConversionRequest;
import org.carball.dpm.converter.ConversionResult;
import org.carball.dpm.converter.DatabaseConverter;
import org.carball.dpm.progress.SilentProgressReporter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

public class ConversionReportTest {

    @TempDir
    Path tempDir;

    @Test
    public void shouldDescribeLoadedTablesInJson() throws Exception {
        // Given
        ConversionReport report = new ConversionReport(convert(false));

        // When
        JsonNode json = new ObjectMapper().readTree(report.toJson());

        // Then
        assertThat(json.path("metadata").path("source").asText()).endsWith("source.sqlite");
        assertThat(json.path("metadata").path("target").asText()).endsWith("dpm.sqlite");
        assertThat(json.path("tables")).hasSize(2);

        JsonNode category = json.path("tables").get(0);
        assertThat(category.path("name").asText()).isEqualTo("Category");
        assertThat(category.path("enumeratedColumns").get(0).asText()).isEqualTo("CategoryType");
        assertThat(category.path("rowsLoaded").asInt()).isEqualTo(1);

        JsonNode item = json.path("tables").get(1);
        assertThat(item.path("foreignKeys").toString()).contains("CategoryGUID -> Category.CategoryGUID");
        assertThat(json.path("skippedTables")).isEmpty();
    }

    @Test
    public void shouldOmitTargetForModelOnlyRuns() throws Exception {
        // Given
        ConversionReport report = new ConversionReport(convert(true));

        // When
        JsonNode json = new ObjectMapper().readTree(report.toJson());
        String markdown = report.toMarkdown();

        // Then
        assertThat(json.path("metadata").has("target")).isFalse();
        assertThat(json.path("tables").get(0).has("rowsLoaded")).isFalse();
        assertThat(markdown).doesNotContain("**Target:**");
        assertThat(markdown).contains("| Rows Loaded | - |");
    }

    @Test
    public void shouldRenderMarkdownSummary() throws Exception {
        // Given
        ConversionReport report = new ConversionReport(convert(false));

        // When
        String markdown = report.toMarkdown();

        // Then
        assertThat(markdown).startsWith("# DPM Conversion Report");
        assertThat(markdown).contains("| Tables | 2 |");
        assertThat(markdown).contains("| Foreign Keys | 2 |");
        assertThat(markdown).contains("| Rows Loaded | 2 |");
        assertThat(markdown).contains("| Category | 2 | 1 | 0 | 1 |");
        assertThat(markdown).contains("| Item | 3 | 0 | 1 | 1 |");
        assertThat(markdown).doesNotContain("## Skipped Data").doesNotContain("## Dependency Cycles");
        assertThat(markdown).endsWith("*Generated by dpm-convert*\n");
    }

    private ConversionResult convert(boolean modelOnly) throws Exception {
        Path source = SqliteFixtures.createCategoryItemDatabase(tempDir.resolve("source.sqlite"));
        ConversionRequest request = new ConversionRequest();
        request.setSource(source);
        request.setTargetDirectory(tempDir.resolve("out"));
        request.setModelOnly(modelOnly);
        return new DatabaseConverter(ConversionConfig.createDefaults(), new SilentProgressReporter()).convert(request);
    }
}
