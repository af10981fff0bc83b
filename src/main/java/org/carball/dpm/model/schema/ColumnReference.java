package org.carball.dpm.model.schema;

/**
 * Target of a foreign key: a column in another (or the same) table.
 *
 * @param augmented true when the key was inferred from a naming convention rather than declared
 */
public record ColumnReference(String table, String column, boolean augmented) {

    public static ColumnReference declared(String table, String column) {
        return new ColumnReference(table, column, false);
    }

    /**
     * Parses a {@code Table.Column} reference as written in configuration files.
     */
    public static ColumnReference parse(String qualifiedName) {
        int dot = qualifiedName == null ? -1 : qualifiedName.indexOf('.');
        if (dot <= 0 || dot == qualifiedName.length() - 1) {
            throw new IllegalArgumentException("Expected Table.Column reference but got: " + qualifiedName);
        }
        return new ColumnReference(qualifiedName.substring(0, dot), qualifiedName.substring(dot + 1), true);
    }

    public boolean pointsTo(String tableName, String columnName) {
        return table.equalsIgnoreCase(tableName) && column.equalsIgnoreCase(columnName);
    }

    @Override
    public String toString() {
        return table + "." + column;
    }
}
