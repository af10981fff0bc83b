package org.carball.dpm.model.data;

import java.util.List;
import java.util.Map;

/**
 * Cast rows of one table, in source order. Produced once by the scan and consumed once
 * by the loader. Row maps keep column order and may hold null values.
 */
public record TableData(String tableName, List<Map<String, Object>> rows) {

    public static TableData empty(String tableName) {
        return new TableData(tableName, List.of());
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
