package org.carball.dpm.model.schema;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Value
@Builder(toBuilder = true)
public class Table {
    String name;
    @Singular
    List<Column> columns;
    @Singular("primaryKeyColumn")
    List<String> primaryKey;

    public Optional<Column> findColumn(String columnName) {
        return columns.stream()
                .filter(c -> c.getName().equalsIgnoreCase(columnName))
                .findFirst();
    }

    public boolean hasPrimaryKey() {
        return !primaryKey.isEmpty();
    }

    public boolean hasCompositePrimaryKey() {
        return primaryKey.size() > 1;
    }

    /**
     * Columns that identify a row: the declared primary key, or else the identity column
     * when the table carries one. Empty for keyless tables.
     */
    public List<Column> keyColumns(String identityColumn) {
        if (hasPrimaryKey()) {
            return primaryKey.stream()
                    .map(this::findColumn)
                    .flatMap(Optional::stream)
                    .collect(Collectors.toList());
        }
        return findColumn(identityColumn).map(List::of).orElse(List.of());
    }

    public List<Column> foreignKeyColumns() {
        return columns.stream()
                .filter(Column::isForeignKey)
                .collect(Collectors.toList());
    }

    /**
     * Returns a copy of this table with the same-named column replaced.
     */
    public Table withColumn(Column column) {
        List<Column> updated = new ArrayList<>(columns.size());
        for (Column existing : columns) {
            updated.add(existing.getName().equals(column.getName()) ? column : existing);
        }
        return toBuilder().clearColumns().columns(updated).build();
    }
}
