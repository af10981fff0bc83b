package org.carball.dpm.cli;

import org.carball.dpm.SqliteFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DpmConvertCLITest {

    @TempDir
    Path tempDir;

    @Test
    public void shouldParseFlagsAndPositionalArguments() {
        // When
        DpmConvertCLI.CliOptions options = DpmConvertCLI.parseArgs(new String[]{
                "db.accdb", "out", "--overwrite", "--model-only", "-v", "--report",
                "--config", "dpm.yml", "--set", "batch-size=10"});

        // Then
        assertThat(options.request.getSource()).isEqualTo(Path.of("db.accdb"));
        assertThat(options.request.getTargetDirectory()).isEqualTo(Path.of("out"));
        assertThat(options.request.isOverwrite()).isTrue();
        assertThat(options.request.isModelOnly()).isTrue();
        assertThat(options.request.isVerbose()).isTrue();
        assertThat(options.writeReport).isTrue();
        assertThat(options.configFile).isEqualTo(Path.of("dpm.yml"));
    }

    @Test
    public void shouldRejectUnknownOption() {
        assertThatThrownBy(() -> DpmConvertCLI.parseArgs(new String[]{"db.accdb", "out", "--fast"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--fast");
    }

    @Test
    public void shouldRejectMissingOptionValue() {
        assertThatThrownBy(() -> DpmConvertCLI.parseArgs(new String[]{"db.accdb", "out", "--config"}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldRejectFileAsTargetDirectory() throws Exception {
        // Given
        Path file = Files.writeString(tempDir.resolve("not-a-dir"), "x");

        // When / Then
        assertThatThrownBy(() -> DpmConvertCLI.parseArgs(new String[]{"db.accdb", file.toString()}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be a directory");
    }

    @Test
    public void shouldExitCleanlyForHelp() {
        assertThat(DpmConvertCLI.run(new String[]{"--help"})).isZero();
    }

    @Test
    public void shouldFailWithoutArguments() {
        assertThat(DpmConvertCLI.run(new String[0])).isEqualTo(1);
    }

    @Test
    public void shouldConvertAndWriteReports() throws Exception {
        // Given
        Path source = SqliteFixtures.createCategoryItemDatabase(tempDir.resolve("source.sqlite"));
        Path out = tempDir.resolve("out");

        // When
        int exitCode = DpmConvertCLI.run(new String[]{
                source.toString(), out.toString(), "--report", "--set", "model-class=TestModel"});

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.resolve("dpm.sqlite")).exists();
        assertThat(out.resolve("TestModel.java")).exists();
        assertThat(out.resolve(DpmConvertCLI.REPORT_BASE_NAME + ".json")).exists();
        assertThat(out.resolve(DpmConvertCLI.REPORT_BASE_NAME + ".md")).exists();
    }

    @Test
    public void shouldReturnFailureForMissingSource() {
        // When
        int exitCode = DpmConvertCLI.run(new String[]{
                tempDir.resolve("missing").toString(), tempDir.resolve("out").toString()});

        // Then
        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    public void shouldReturnFailureWhenStoreExists() throws Exception {
        // Given
        Path source = SqliteFixtures.createCategoryItemDatabase(tempDir.resolve("source.sqlite"));
        Path out = Files.createDirectories(tempDir.resolve("out"));
        Files.writeString(out.resolve("dpm.sqlite"), "existing");

        // When
        int exitCode = DpmConvertCLI.run(new String[]{source.toString(), out.toString()});

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(Files.readString(out.resolve("dpm.sqlite"))).isEqualTo("existing");
    }
}
