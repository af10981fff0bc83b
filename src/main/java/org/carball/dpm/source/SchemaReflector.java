package org.carball.dpm.source;

import lombok.extern.slf4j.Slf4j;
import org.carball.dpm.model.schema.Column;
import org.carball.dpm.model.schema.ColumnReference;
import org.carball.dpm.model.schema.DatabaseSchema;
import org.carball.dpm.model.schema.RawType;
import org.carball.dpm.model.schema.Table;
import org.carball.dpm.transform.TypeRefiner;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Reads the physical schema of the source through JDBC metadata. Column types are
 * refined as they are reflected, so no row is ever cast against an unrefined type.
 */
@Slf4j
public class SchemaReflector {

    private final TypeRefiner refiner;
    private final List<String> ignoredTablePrefixes;

    public SchemaReflector(TypeRefiner refiner, List<String> ignoredTablePrefixes) {
        this.refiner = refiner;
        this.ignoredTablePrefixes = ignoredTablePrefixes;
    }

    public DatabaseSchema reflect(Connection connection) throws SQLException {
        DatabaseMetaData metaData = connection.getMetaData();

        TreeSet<String> tableNames = new TreeSet<>();
        try (ResultSet rs = metaData.getTables(null, null, "%", new String[]{"TABLE"})) {
            while (rs.next()) {
                String name = rs.getString("TABLE_NAME");
                if (isIgnored(name)) {
                    log.debug("Skipping system table {}", name);
                } else {
                    tableNames.add(name);
                }
            }
        }

        List<Table> tables = new ArrayList<>(tableNames.size());
        for (String tableName : tableNames) {
            tables.add(reflectTable(metaData, tableName));
        }

        DatabaseSchema schema = resolveImplicitReferences(new DatabaseSchema(tables));
        log.info("Reflected {} tables", schema.size());
        return schema;
    }

    private Table reflectTable(DatabaseMetaData metaData, String tableName) throws SQLException {
        Map<String, Integer> primaryKey = new HashMap<>();
        try (ResultSet rs = metaData.getPrimaryKeys(null, null, tableName)) {
            while (rs.next()) {
                primaryKey.put(rs.getString("COLUMN_NAME"), rs.getInt("KEY_SEQ"));
            }
        }

        Map<String, ColumnReference> foreignKeys = new HashMap<>();
        try (ResultSet rs = metaData.getImportedKeys(null, null, tableName)) {
            while (rs.next()) {
                foreignKeys.put(rs.getString("FKCOLUMN_NAME"),
                        ColumnReference.declared(rs.getString("PKTABLE_NAME"), rs.getString("PKCOLUMN_NAME")));
            }
        }

        // Table names are LIKE patterns here, so filter out accidental matches
        TreeMap<Integer, Column> columns = new TreeMap<>();
        try (ResultSet rs = metaData.getColumns(null, null, tableName, "%")) {
            while (rs.next()) {
                if (!tableName.equalsIgnoreCase(rs.getString("TABLE_NAME"))) {
                    continue;
                }
                String name = rs.getString("COLUMN_NAME");
                RawType rawType = new RawType(rs.getInt("DATA_TYPE"), rs.getString("TYPE_NAME"));
                int ordinal = rs.getInt("ORDINAL_POSITION");
                columns.put(ordinal, Column.builder()
                        .name(name)
                        .ordinal(ordinal)
                        .rawType(rawType)
                        .type(refiner.refine(name, rawType))
                        .nullable(rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls)
                        .primaryKey(primaryKey.containsKey(name))
                        .foreignKey(foreignKeys.get(name))
                        .build());
            }
        }

        Table.TableBuilder table = Table.builder()
                .name(tableName)
                .columns(columns.values());
        primaryKey.entrySet().stream()
                .sorted(Map.Entry.comparingByValue(Comparator.naturalOrder()))
                .forEach(entry -> table.primaryKeyColumn(entry.getKey()));

        log.debug("Reflected table {} with {} columns and {} foreign keys", tableName, columns.size(), foreignKeys.size());
        return table.build();
    }

    // A REFERENCES clause without a column list points at the target's primary key
    private DatabaseSchema resolveImplicitReferences(DatabaseSchema schema) {
        DatabaseSchema resolved = schema;
        for (Table table : schema.getTables()) {
            Table updated = table;
            for (Column column : table.foreignKeyColumns()) {
                ColumnReference reference = column.getForeignKey();
                if (reference.column() != null && !reference.column().isBlank()) {
                    continue;
                }
                Optional<String> targetKey = schema.findTable(reference.table())
                        .filter(Table::hasPrimaryKey)
                        .map(target -> target.getPrimaryKey().get(0));
                Column fixed = column.toBuilder()
                        .foreignKey(targetKey.map(key -> ColumnReference.declared(reference.table(), key)).orElse(null))
                        .build();
                if (targetKey.isEmpty()) {
                    log.warn("Dropping foreign key {}.{}: {} has no primary key to reference",
                            table.getName(), column.getName(), reference.table());
                }
                updated = updated.withColumn(fixed);
            }
            if (updated != table) {
                resolved = resolved.withTable(updated);
            }
        }
        return resolved;
    }

    private boolean isIgnored(String tableName) {
        String lower = tableName.toLowerCase(Locale.ROOT);
        return ignoredTablePrefixes.stream().anyMatch(prefix -> lower.startsWith(prefix.toLowerCase(Locale.ROOT)));
    }
}
