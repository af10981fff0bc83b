package org.carball.dpm.generation;

import org.carball.dpm.model.schema.Column;
import org.carball.dpm.model.schema.ColumnReference;

import java.util.Map;

/**
 * Derives the relationship name for a foreign key column from the column and table names.
 * <ol>
 *   <li>Configured overrides win, otherwise the identifier and key suffixes are stripped.</li>
 *   <li>A name equal to the owning table (key-to-key links) becomes the referenced table.</li>
 *   <li>A name that stripping left unchanged is combined with the referenced table, or
 *       prefixed with {@value #RELATED_PREFIX} when it already contains that table.</li>
 *   <li>References back into the owning table are always named {@value #SELF}.</li>
 * </ol>
 * Names returned here are not unique yet; see {@link NameRegistry}.
 */
public class RelationshipNamer {

    public static final String SELF = "Self";
    static final String RELATED_PREFIX = "Related";

    private final Map<String, String> overrides;

    public RelationshipNamer(Map<String, String> overrides) {
        this.overrides = Map.copyOf(overrides);
    }

    public String baseName(String owningTable, Column column) {
        if (column.isSelfReference(owningTable)) {
            return SELF;
        }

        ColumnReference target = column.getForeignKey();
        String columnName = column.getName();
        String name = overrides.getOrDefault(columnName, stripSuffixes(columnName));

        if (name.isEmpty() || name.equals(owningTable)) {
            name = target.table();
        }
        if (name.equals(columnName)) {
            name = name.contains(target.table()) ? RELATED_PREFIX + name : name + target.table();
        }
        return name;
    }

    /**
     * Java field name for a relationship, keyword-safe but not yet de-duplicated.
     */
    public String fieldName(String owningTable, Column column) {
        return NameUtils.escapeKeyword(NameUtils.toCamelCase(baseName(owningTable, column)));
    }

    static String stripSuffixes(String columnName) {
        String name = removeSuffix(columnName, "GUID");
        name = name.replace("VID", "Version");
        return removeSuffix(name, "ID");
    }

    private static String removeSuffix(String value, String suffix) {
        return value.endsWith(suffix) ? value.substring(0, value.length() - suffix.length()) : value;
    }
}
