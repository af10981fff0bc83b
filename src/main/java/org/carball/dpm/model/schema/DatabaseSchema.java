package org.carball.dpm.model.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable set of tables keyed by name. Every pipeline stage derives a new schema
 * instead of mutating the one it was given.
 */
public final class DatabaseSchema {

    private final Map<String, Table> tables;

    public DatabaseSchema(List<Table> tables) {
        Map<String, Table> byName = new LinkedHashMap<>();
        for (Table table : tables) {
            if (byName.putIfAbsent(table.getName(), table) != null) {
                throw new IllegalArgumentException("Duplicate table: " + table.getName());
            }
        }
        this.tables = Collections.unmodifiableMap(byName);
    }

    public List<Table> getTables() {
        return List.copyOf(tables.values());
    }

    public Set<String> getTableNames() {
        return tables.keySet();
    }

    public Optional<Table> findTable(String name) {
        Table exact = tables.get(name);
        if (exact != null) {
            return Optional.of(exact);
        }
        return tables.values().stream()
                .filter(t -> t.getName().equalsIgnoreCase(name))
                .findFirst();
    }

    public Table getTable(String name) {
        return findTable(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown table: " + name));
    }

    public DatabaseSchema withTable(Table table) {
        if (!tables.containsKey(table.getName())) {
            throw new IllegalArgumentException("Unknown table: " + table.getName());
        }
        List<Table> updated = new ArrayList<>(tables.size());
        for (Table existing : tables.values()) {
            updated.add(existing.getName().equals(table.getName()) ? table : existing);
        }
        return new DatabaseSchema(updated);
    }

    /**
     * Names of the other tables this table has foreign keys into. References to tables
     * outside the schema and self references are left out.
     */
    public Set<String> dependenciesOf(String tableName) {
        Set<String> dependencies = new TreeSet<>();
        for (Column column : getTable(tableName).foreignKeyColumns()) {
            findTable(column.getForeignKey().table())
                    .map(Table::getName)
                    .filter(target -> !target.equals(tableName))
                    .ifPresent(dependencies::add);
        }
        return dependencies;
    }

    public int size() {
        return tables.size();
    }
}
