package org.carball.dpm.transform;

import lombok.extern.slf4j.Slf4j;
import org.carball.dpm.model.schema.Column;
import org.carball.dpm.model.schema.ColumnReference;
import org.carball.dpm.model.schema.DatabaseSchema;
import org.carball.dpm.model.schema.Table;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Adds foreign keys the source only expresses through naming convention, such as a
 * row identifier that always points at the concept table. Declared keys are never
 * replaced, so running it twice changes nothing.
 */
@Slf4j
public class RelationshipAugmenter {

    private final Map<String, ColumnReference> mappings = new LinkedHashMap<>();

    public RelationshipAugmenter(Map<String, String> foreignKeyMappings) {
        foreignKeyMappings.forEach((column, target) -> mappings.put(column, ColumnReference.parse(target)));
    }

    public DatabaseSchema augment(DatabaseSchema schema) {
        List<Table> tables = new ArrayList<>(schema.size());
        int added = 0;

        for (Table table : schema.getTables()) {
            Table augmented = table;
            for (Map.Entry<String, ColumnReference> mapping : mappings.entrySet()) {
                Optional<Column> column = augmented.findColumn(mapping.getKey());
                if (column.isEmpty() || column.get().isForeignKey()) {
                    continue;
                }
                Optional<ColumnReference> target = resolve(schema, mapping.getValue());
                if (target.isEmpty()) {
                    log.warn("Cannot augment {}.{}: target {} is not in the schema",
                            table.getName(), mapping.getKey(), mapping.getValue());
                    continue;
                }
                augmented = augmented.withColumn(column.get().toBuilder().foreignKey(target.get()).build());
                log.debug("Augmented foreign key {}.{} -> {}", table.getName(), column.get().getName(), target.get());
                added++;
            }
            tables.add(augmented);
        }

        log.info("Added {} conventional foreign keys", added);
        return new DatabaseSchema(tables);
    }

    // Resolves to the actual spelling of the target table and column
    private Optional<ColumnReference> resolve(DatabaseSchema schema, ColumnReference reference) {
        return schema.findTable(reference.table())
                .flatMap(table -> table.findColumn(reference.column())
                        .map(column -> new ColumnReference(table.getName(), column.getName(), true)));
    }
}
