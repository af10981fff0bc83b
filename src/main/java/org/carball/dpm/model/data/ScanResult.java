package org.carball.dpm.model.data;

import org.carball.dpm.model.schema.Column;
import org.carball.dpm.model.schema.Table;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Outcome of a full-table scan: the cast rows plus the enum domains and nullable
 * columns observed across every row.
 */
public record ScanResult(TableData data,
                         Map<String, SortedSet<String>> enumDomains,
                         Set<String> nullableColumns) {

    /**
     * Derives the table with scan verdicts applied: enum domains attached and
     * nullability taken from the data rather than from the source declaration.
     */
    public Table applyTo(Table table) {
        Table.TableBuilder builder = table.toBuilder().clearColumns();
        for (Column column : table.getColumns()) {
            Column.ColumnBuilder refined = column.toBuilder()
                    .nullable(nullableColumns.contains(column.getName()));
            SortedSet<String> domain = enumDomains.get(column.getName());
            if (domain != null && !domain.isEmpty()) {
                refined.enumDomain(Collections.unmodifiableSortedSet(new TreeSet<>(domain)));
            }
            builder.column(refined.build());
        }
        return builder.build();
    }
}
