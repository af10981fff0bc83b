package org.carball.dpm.model.schema;

import lombok.Builder;
import lombok.Value;

import java.util.SortedSet;

@Value
@Builder(toBuilder = true)
public class Column {
    String name;
    int ordinal;
    RawType rawType;
    LogicalType type;
    boolean nullable;
    boolean primaryKey;
    ColumnReference foreignKey;
    SortedSet<String> enumDomain;

    public boolean isForeignKey() {
        return foreignKey != null;
    }

    public boolean isEnumerated() {
        return enumDomain != null && !enumDomain.isEmpty();
    }

    /**
     * True when the key points back into the owning table, on any column.
     */
    public boolean isSelfReference(String owningTable) {
        return foreignKey != null && foreignKey.table().equalsIgnoreCase(owningTable);
    }

    /**
     * True when the key points at this very column, as a key-to-itself declaration does.
     */
    public boolean referencesItself(String owningTable) {
        return foreignKey != null && foreignKey.pointsTo(owningTable, name);
    }
}
