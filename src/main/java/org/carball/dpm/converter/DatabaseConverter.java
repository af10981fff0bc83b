package org.carball.dpm.converter;

import lombok.extern.slf4j.Slf4j;
import org.carball.dpm.config.ConversionConfig;
import org.carball.dpm.exception.ConversionException;
import org.carball.dpm.exception.ExtractionException;
import org.carball.dpm.generation.ModelSynthesizer;
import org.carball.dpm.model.data.ScanResult;
import org.carball.dpm.model.data.TableData;
import org.carball.dpm.model.schema.DatabaseSchema;
import org.carball.dpm.model.schema.Table;
import org.carball.dpm.progress.ProgressReporter;
import org.carball.dpm.source.SchemaReflector;
import org.carball.dpm.source.SourceConnectionFactory;
import org.carball.dpm.source.SourceLocator;
import org.carball.dpm.source.TableExtractor;
import org.carball.dpm.target.MigrationListener;
import org.carball.dpm.target.MigrationSummary;
import org.carball.dpm.target.SqliteLoader;
import org.carball.dpm.transform.DataScanner;
import org.carball.dpm.transform.DependencyOrderer;
import org.carball.dpm.transform.RelationshipAugmenter;
import org.carball.dpm.transform.TableOrder;
import org.carball.dpm.transform.TypeRefiner;
import org.carball.dpm.transform.ValueCaster;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the whole conversion of one source database: locate, reflect and scan, augment,
 * order, synthesize the model and load the target store.
 */
@Slf4j
public class DatabaseConverter {

    private final SourceLocator locator;
    private final SourceConnectionFactory connectionFactory;
    private final SchemaReflector reflector;
    private final TableExtractor extractor;
    private final DataScanner scanner;
    private final RelationshipAugmenter augmenter;
    private final DependencyOrderer orderer;
    private final ModelSynthesizer synthesizer;
    private final SqliteLoader loader;
    private final List<MigrationListener> listeners = new ArrayList<>();

    public DatabaseConverter(ConversionConfig config, ProgressReporter progress) {
        this(config, progress, new TableExtractor());
    }

    DatabaseConverter(ConversionConfig config, ProgressReporter progress, TableExtractor extractor) {
        this.locator = new SourceLocator(config.getSourceExtensions(), config.getPreferredDatabaseKeyword());
        this.connectionFactory = new SourceConnectionFactory();
        this.reflector = new SchemaReflector(new TypeRefiner(config), config.getIgnoredTablePrefixes());
        this.extractor = extractor;
        this.scanner = new DataScanner(config.getPatterns(), new ValueCaster());
        this.augmenter = new RelationshipAugmenter(config.getForeignKeyMappings());
        this.orderer = new DependencyOrderer();
        this.synthesizer = new ModelSynthesizer(config);
        this.loader = new SqliteLoader(config, progress);

        log.info("Initialized DatabaseConverter with config: {}", config.getDescription());
    }

    public void addListener(MigrationListener listener) {
        listeners.add(listener);
    }

    public ConversionResult convert(ConversionRequest request) {
        Instant started = Instant.now();
        log.info("Starting conversion of {}", request.getSource());

        // Step 1: Locate the source and refuse early if the target may not be replaced
        Path database = locator.locate(request.getSource());
        if (!request.isModelOnly()) {
            loader.checkTarget(request.getTargetDirectory(), request.isOverwrite());
        }
        if (request.isVerbose()) {
            System.out.println("  - Reading " + database.getFileName() + "...");
        }

        // Step 2: Reflect the schema and scan every table
        Map<String, TableData> data = new LinkedHashMap<>();
        Map<String, Integer> rowsScanned = new LinkedHashMap<>();
        List<String> failed = new ArrayList<>();
        DatabaseSchema schema;
        try (Connection connection = connectionFactory.open(database)) {
            DatabaseSchema reflected = reflector.reflect(connection);
            List<Table> scanned = new ArrayList<>(reflected.size());
            for (Table table : reflected.getTables()) {
                try {
                    ScanResult result = scan(connection, table);
                    scanned.add(result.applyTo(table));
                    data.put(table.getName(), result.data());
                    rowsScanned.put(table.getName(), result.data().size());
                } catch (ExtractionException e) {
                    log.warn("{}; table {} is kept without data", e.getMessage(), e.tableName());
                    failed.add(e.tableName());
                    scanned.add(table);
                }
            }
            schema = new DatabaseSchema(scanned);
        } catch (SQLException e) {
            throw new ConversionException("Failed to read source database " + database + ": " + e.getMessage(), e);
        }
        Duration scanDuration = Duration.between(started, Instant.now());
        log.info("Scanned {} tables in {} ms ({} skipped)", schema.size(), scanDuration.toMillis(), failed.size());

        // Step 3: Add conventional keys and decide the creation order
        if (request.isVerbose()) {
            System.out.println("  - Resolving relationships...");
        }
        schema = augmenter.augment(schema);
        TableOrder order = orderer.order(schema);

        // Step 4: Synthesize the model before touching the target
        if (request.isVerbose()) {
            System.out.println("  - Generating model...");
        }
        String modelSource = synthesizer.synthesize(schema, order);

        // Step 5: Load the store
        MigrationSummary migration = null;
        if (!request.isModelOnly()) {
            if (request.isVerbose()) {
                System.out.println("  - Loading " + schema.size() + " tables...");
            }
            migration = loader.load(schema, order, data, request.getTargetDirectory(), request.isOverwrite());
            data.clear();
        }

        Path modelFile = synthesizer.write(modelSource, request.getTargetDirectory());

        if (migration != null) {
            for (MigrationListener listener : listeners) {
                listener.onMigrated(migration);
            }
        }

        Duration total = Duration.between(started, Instant.now());
        log.info("Conversion complete in {} ms", total.toMillis());
        return new ConversionResult(database, schema, order, rowsScanned, List.copyOf(failed), modelFile,
                migration, started, scanDuration, total);
    }

    private ScanResult scan(Connection connection, Table table) {
        try {
            return scanner.scan(table, extractor.readRows(connection, table));
        } catch (SQLException | RuntimeException e) {
            throw new ExtractionException(table.getName(), e);
        }
    }
}
