package org.carball.dpm.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > YAML file > defaults
     */
    public ConversionConfig loadConfiguration(Path configFile, String[] args) throws IOException {
        ConversionConfig config = configFile != null ? loadFile(configFile) : ConversionConfig.createDefaults();

        applyEnvironmentVariables(config);
        applyCLIArguments(config, args);

        config.validate();
        log.info("Configuration loaded: {}", config.getDescription());
        return config;
    }

    /**
     * Reads a YAML configuration file; settings it leaves out keep their defaults.
     */
    public ConversionConfig loadFile(Path configFile) throws IOException {
        if (!Files.exists(configFile)) {
            throw new IllegalArgumentException("Configuration file not found: " + configFile);
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        ConversionConfig config = mapper.readValue(configFile.toFile(), ConversionConfig.class);
        log.info("Loaded configuration from: {}", configFile);
        return config;
    }

    private void applyEnvironmentVariables(ConversionConfig config) {
        apply(config, "batch-size", environment.get("DPM_BATCH_SIZE"));
        apply(config, "hub-table", environment.get("DPM_HUB_TABLE"));
        apply(config, "model-package", environment.get("DPM_MODEL_PACKAGE"));
        apply(config, "target-file", environment.get("DPM_TARGET_FILE"));
    }

    private void applyCLIArguments(ConversionConfig config, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if (!"--set".equals(args[i])) {
                continue;
            }
            String assignment = args[i + 1];
            int eq = assignment.indexOf('=');
            if (eq <= 0) {
                log.warn("Ignoring malformed setting '{}', expected key=value", assignment);
                continue;
            }
            apply(config, assignment.substring(0, eq).trim(), assignment.substring(eq + 1).trim());
        }
    }

    private void apply(ConversionConfig config, String key, String value) {
        if (value == null) {
            return;
        }
        switch (key) {
            case "batch-size":
                try {
                    config.setBatchSize(Integer.parseInt(value));
                } catch (NumberFormatException e) {
                    log.warn("Invalid numeric value for {}: {}", key, value);
                }
                break;
            case "hub-table":
                config.setHubTable(value);
                break;
            case "identity-column":
                config.setIdentityColumn(value);
                break;
            case "keyword":
                config.setPreferredDatabaseKeyword(value);
                break;
            case "model-package":
                config.setModelPackage(value);
                break;
            case "model-class":
                config.setModelClassName(value);
                break;
            case "target-file":
                config.setTargetFileName(value);
                break;
            default:
                log.warn("Unknown setting: {}", key);
        }
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getSettingsHelp() {
        return """
            Settings (--set key=value):
              batch-size <num>        Rows per insert batch (default 50000)
              hub-table <name>        Table emitted with deferred model references (default Concept)
              identity-column <name>  Column used as key for tables without a primary key (default RowGUID)
              keyword <text>          Preferred substring when picking a database from a directory (default dpm)
              model-package <pkg>     Package of the generated model (default eu.dpm.model)
              model-class <name>      Holder class of the generated model (default Dpm)
              target-file <name>      File name of the SQLite store (default dpm.sqlite)

            Environment Variables:
              DPM_BATCH_SIZE          Same as batch-size
              DPM_HUB_TABLE           Same as hub-table
              DPM_MODEL_PACKAGE       Same as model-package
              DPM_TARGET_FILE         Same as target-file

            Priority Order (highest to lowest):
              1. --set arguments
              2. Environment variables
              3. --config YAML file
              4. Built-in defaults
            """;
    }
}
