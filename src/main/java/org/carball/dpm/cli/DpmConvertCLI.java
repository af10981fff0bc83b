package org.carball.dpm.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import lombok.extern.slf4j.Slf4j;
import org.carball.dpm.config.ConfigurationLoader;
import org.carball.dpm.config.ConversionConfig;
import org.carball.dpm.converter.ConversionRequest;
import org.carball.dpm.converter.ConversionResult;
import org.carball.dpm.converter.DatabaseConverter;
import org.carball.dpm.exception.DatabaseNotFoundException;
import org.carball.dpm.exception.ConversionException;
import org.carball.dpm.exception.TargetConflictException;
import org.carball.dpm.output.ConversionReport;
import org.carball.dpm.progress.LoggingProgressReporter;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

@Slf4j
public class DpmConvertCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║            DPM Access to SQLite Converter v%s               ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;
    static final String REPORT_BASE_NAME = "conversion-report";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs the converter and returns the process exit code.
     */
    static int run(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (isHelpRequested(args)) {
            printUsage();
            return 0;
        }
        if (args.length < 2) {
            printUsage();
            return 1;
        }

        try {
            CliOptions options = parseArgs(args);
            if (options.request.isVerbose()) {
                enableDebugLogging();
            }

            ConversionConfig config = new ConfigurationLoader().loadConfiguration(options.configFile, args);
            ConversionRequest request = options.request;

            System.out.println("\n🔍 Starting conversion...");
            System.out.println("   Source: " + request.getSource());
            System.out.println("   Target directory: " + request.getTargetDirectory());
            if (request.isModelOnly()) {
                System.out.println("   Mode: model only");
            }
            System.out.println();

            DatabaseConverter converter = new DatabaseConverter(config, new LoggingProgressReporter());
            converter.addListener(summary -> System.out.println("   Store written: " + summary.target()));

            System.out.println("📦 Converting database... ");
            ConversionResult result = converter.convert(request);
            System.out.println("✓");

            if (options.writeReport) {
                System.out.print("📝 Writing report... ");
                writeReport(result, request.getTargetDirectory());
                System.out.println("✓");
            }

            printSummary(result);
            System.out.println("\n✅ Conversion complete!");
            System.out.println("   Model file: " + result.modelFile());
            return 0;

        } catch (DatabaseNotFoundException e) {
            System.err.println("\n❌ " + e.getMessage());
            log.debug("Source lookup failed for {}", e.source(), e);
            return 1;
        } catch (TargetConflictException e) {
            System.err.println("\n❌ " + e.getMessage());
            System.err.println("   Run with --overwrite to replace " + e.target());
            return 1;
        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (ConversionException e) {
            System.err.println("\n❌ Conversion failed: " + e.getMessage());
            log.debug("Conversion error details", e);
            return 1;
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return 1;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar dpm-convert.jar <source> <target-directory> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  source              Access database (.accdb, .mdb) or a directory containing one");
        System.out.println("  target-directory    Directory receiving the SQLite store and the generated model");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --overwrite         Replace an existing store in the target directory");
        System.out.println("  --model-only        Generate the model without writing the store");
        System.out.println("  --config <file>     YAML file with conversion settings");
        System.out.println("  --set key=value     Override a single setting (repeatable)");
        System.out.println("  --report            Write " + REPORT_BASE_NAME + ".json and .md to the target directory");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println(ConfigurationLoader.getSettingsHelp());
        System.out.println("Examples:");
        System.out.println("  java -jar dpm-convert.jar ./downloads/dpm ./out");
        System.out.println("  java -jar dpm-convert.jar DPM_Database.accdb ./out --overwrite --report");
        System.out.println("  java -jar dpm-convert.jar DPM_Database.accdb ./out --model-only --set model-package=org.example.dpm");
    }

    static CliOptions parseArgs(String[] args) {
        CliOptions options = new CliOptions();
        options.request.setSource(Paths.get(args[0]));
        options.request.setTargetDirectory(Paths.get(args[1]));

        for (int i = 2; i < args.length; i++) {
            switch (args[i]) {
                case "--overwrite":
                    options.request.setOverwrite(true);
                    break;

                case "--model-only":
                    options.request.setModelOnly(true);
                    break;

                case "--report":
                    options.writeReport = true;
                    break;

                case "--verbose":
                case "-v":
                    options.request.setVerbose(true);
                    break;

                case "--config":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Configuration file not specified");
                    }
                    options.configFile = Paths.get(args[++i]);
                    break;

                case "--set":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Setting not specified, expected key=value");
                    }
                    // Applied by ConfigurationLoader
                    i++;
                    break;

                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        if (Files.exists(options.request.getTargetDirectory())
                && !Files.isDirectory(options.request.getTargetDirectory())) {
            throw new IllegalArgumentException("Target path must be a directory: " + options.request.getTargetDirectory());
        }
        return options;
    }

    private static void writeReport(ConversionResult result, Path directory) throws IOException {
        ConversionReport report = new ConversionReport(result);
        Files.createDirectories(directory);
        Files.writeString(directory.resolve(REPORT_BASE_NAME + ".json"), report.toJson());
        Files.writeString(directory.resolve(REPORT_BASE_NAME + ".md"), report.toMarkdown());
    }

    private static void printSummary(ConversionResult result) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 CONVERSION SUMMARY");
        System.out.println("=".repeat(60));

        System.out.println("\nTables: " + result.schema().size());
        System.out.println("Rows scanned: " + result.rowsScanned().values().stream().mapToInt(Integer::intValue).sum());
        if (!result.isModelOnly()) {
            System.out.println("Rows loaded: " + result.migration().totalRows());
            result.migration().skippedTables()
                    .forEach(t -> System.out.println("  ⚠️ Data not loaded: " + t));
        }
        result.failedExtractions()
                .forEach(t -> System.out.println("  ⚠️ Data not readable: " + t));
        result.order().advisories()
                .forEach(a -> System.out.println("  🔁 " + a));
        System.out.printf("Duration: %.1f s%n", result.totalDuration().toMillis() / 1000.0);
    }

    private static void enableDebugLogging() {
        Logger logger = (Logger) LoggerFactory.getLogger("org.carball.dpm");
        logger.setLevel(Level.DEBUG);
    }

    static final class CliOptions {
        final ConversionRequest request = new ConversionRequest();
        Path configFile;
        boolean writeReport;
    }
}
