package org.carball.dpm.transform;

import lombok.extern.slf4j.Slf4j;
import org.carball.dpm.config.ColumnPatterns;
import org.carball.dpm.model.data.ScanResult;
import org.carball.dpm.model.data.TableData;
import org.carball.dpm.model.schema.Column;
import org.carball.dpm.model.schema.Table;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Casts every row of a table and accumulates, over the whole row set, the enum domain
 * of enum-like columns and the set of columns that ever held null. Both verdicts are
 * only final once the last row has been seen, so the full table is held in memory.
 */
@Slf4j
public class DataScanner {

    private final ColumnPatterns patterns;
    private final ValueCaster caster;

    public DataScanner(ColumnPatterns patterns, ValueCaster caster) {
        this.patterns = patterns;
        this.caster = caster;
    }

    public ScanResult scan(Table table, List<Map<String, Object>> rawRows) {
        List<Map<String, Object>> rows = new ArrayList<>(rawRows.size());
        Map<String, SortedSet<String>> enums = new TreeMap<>();
        Set<String> nullables = new LinkedHashSet<>();

        for (Map<String, Object> rawRow : rawRows) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (Column column : table.getColumns()) {
                Object value = caster.cast(table.getName(), column, rawRow.get(column.getName()));
                row.put(column.getName(), value);

                if (value == null) {
                    nullables.add(column.getName());
                } else if (value instanceof String text && patterns.isEnum(column.getName())) {
                    enums.computeIfAbsent(column.getName(), k -> new TreeSet<>()).add(text);
                }
            }
            rows.add(row);
        }

        log.debug("Scanned {} rows of {}: {} enum columns, {} nullable columns",
                rows.size(), table.getName(), enums.size(), nullables.size());
        return new ScanResult(new TableData(table.getName(), rows), enums, nullables);
    }
}
