package org.carball.dpm.target;

import lombok.extern.slf4j.Slf4j;
import org.carball.dpm.config.ConversionConfig;
import org.carball.dpm.exception.StoreCreationException;
import org.carball.dpm.exception.TargetConflictException;
import org.carball.dpm.model.data.TableData;
import org.carball.dpm.model.schema.Column;
import org.carball.dpm.model.schema.DatabaseSchema;
import org.carball.dpm.model.schema.Table;
import org.carball.dpm.progress.ProgressReporter;
import org.carball.dpm.transform.TableOrder;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Creates the refined schema in a fresh SQLite file and bulk-loads the scanned rows.
 * Everything is written to a staging file next to the target, which is moved onto the
 * target name only once complete, so a failed run never leaves a partial store behind.
 */
@Slf4j
public class SqliteLoader {

    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ConversionConfig config;
    private final SqliteDdlBuilder ddlBuilder;
    private final ProgressReporter progress;

    public SqliteLoader(ConversionConfig config, ProgressReporter progress) {
        this.config = config;
        this.ddlBuilder = new SqliteDdlBuilder(config.isWithoutRowid());
        this.progress = progress;
    }

    /**
     * Fails fast when the target exists and may not be replaced. Never touches the file.
     */
    public Path checkTarget(Path targetDirectory, boolean overwrite) {
        Path target = targetDirectory.resolve(config.getTargetFileName());
        if (Files.exists(target) && !overwrite) {
            throw new TargetConflictException(target);
        }
        return target;
    }

    public MigrationSummary load(DatabaseSchema schema,
                                 TableOrder order,
                                 Map<String, TableData> data,
                                 Path targetDirectory,
                                 boolean overwrite) {
        Path target = checkTarget(targetDirectory, overwrite);
        Path staging = createStaging(targetDirectory);

        List<String> created = new ArrayList<>();
        Map<String, Integer> loaded = new LinkedHashMap<>();
        List<String> skipped = new ArrayList<>();

        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + staging.toAbsolutePath())) {
            for (String tableName : order.tables()) {
                createTable(connection, schema.getTable(tableName));
                created.add(tableName);
            }

            for (String tableName : order.tables()) {
                TableData rows = data.get(tableName);
                if (rows == null || rows.isEmpty()) {
                    continue;
                }
                if (loadTable(connection, schema.getTable(tableName), rows)) {
                    loaded.put(tableName, rows.size());
                } else {
                    skipped.add(tableName);
                }
            }

            connection.setAutoCommit(true);
            try (Statement statement = connection.createStatement()) {
                statement.execute("VACUUM");
            }
        } catch (SQLException e) {
            deleteQuietly(staging);
            throw new StoreCreationException("Failed to create SQLite database: " + e.getMessage(), e);
        }

        promote(staging, target, overwrite);
        log.info("Saved: {}", target);
        return new MigrationSummary(target, List.copyOf(created), loaded, List.copyOf(skipped));
    }

    private void createTable(Connection connection, Table table) throws SQLException {
        String ddl = ddlBuilder.createTable(table);
        log.debug("Creating table: {}", ddl);
        try (Statement statement = connection.createStatement()) {
            statement.execute(ddl);
        }
    }

    /**
     * Inserts one table's rows in batches inside a single transaction.
     *
     * @return false when the insert failed and the table was rolled back to empty
     */
    private boolean loadTable(Connection connection, Table table, TableData data) throws SQLException {
        List<Column> columns = table.getColumns();
        String sql = String.format("INSERT INTO %s (%s) VALUES (%s)",
                SqliteDdlBuilder.quote(table.getName()),
                columns.stream().map(c -> SqliteDdlBuilder.quote(c.getName())).collect(Collectors.joining(", ")),
                columns.stream().map(c -> "?").collect(Collectors.joining(", ")));

        progress.startTable(table.getName(), data.size());
        connection.setAutoCommit(false);
        try (PreparedStatement insert = connection.prepareStatement(sql)) {
            int processed = 0;
            for (Map<String, Object> row : data.rows()) {
                for (int i = 0; i < columns.size(); i++) {
                    insert.setObject(i + 1, toSqlValue(row.get(columns.get(i).getName())));
                }
                insert.addBatch();
                processed++;
                if (processed % config.getBatchSize() == 0) {
                    insert.executeBatch();
                    progress.updateProgress(table.getName(), processed);
                }
            }
            insert.executeBatch();
            connection.commit();
            progress.updateProgress(table.getName(), processed);
            return true;
        } catch (SQLException e) {
            connection.rollback();
            log.warn("Skipping data of table {}: insert failed ({})", table.getName(), e.getMessage());
            return false;
        } finally {
            progress.finishTable(table.getName());
        }
    }

    static Object toSqlValue(Object value) {
        if (value instanceof LocalDate date) {
            return date.toString();
        } else if (value instanceof LocalDateTime dateTime) {
            return dateTime.format(DATE_TIME);
        } else if (value instanceof Boolean flag) {
            return flag ? 1 : 0;
        } else if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        } else if (value instanceof UUID uuid) {
            return uuid.toString();
        }
        return value;
    }

    private Path createStaging(Path targetDirectory) {
        try {
            Files.createDirectories(targetDirectory);
            return Files.createTempFile(targetDirectory, "." + config.getTargetFileName() + "-", ".staging");
        } catch (IOException e) {
            throw new StoreCreationException("Failed to create staging file in " + targetDirectory, e);
        }
    }

    /**
     * Moves the staged store into place. Without {@code overwrite} a target that appeared
     * while loading is left alone; an atomic rename would silently replace it on POSIX.
     * The check and the move are still two steps, so a writer racing into that gap wins.
     */
    private void promote(Path staging, Path target, boolean overwrite) {
        try {
            if (overwrite) {
                Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } else {
                if (Files.exists(target)) {
                    throw new FileAlreadyExistsException(target.toString());
                }
                Files.move(staging, target);
            }
        } catch (FileAlreadyExistsException e) {
            deleteQuietly(staging);
            throw new TargetConflictException(target);
        } catch (IOException e) {
            deleteQuietly(staging);
            throw new StoreCreationException("Failed to move staged database to " + target, e);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete staging file {}: {}", file, e.getMessage());
        }
    }
}
