package org.carball.dpm.target;

import net.sf.jsqlparser.statement.create.table.ColDataType;
import net.sf.jsqlparser.statement.create.table.ColumnDefinition;
import net.sf.jsqlparser.statement.create.table.CreateTable;
import net.sf.jsqlparser.statement.create.table.Index;
import org.carball.dpm.model.schema.Column;
import org.carball.dpm.model.schema.ColumnReference;
import org.carball.dpm.model.schema.LogicalType;
import org.carball.dpm.model.schema.Table;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders refined tables as SQLite {@code CREATE TABLE} statements. Source indexes are
 * not carried over; keyed tables are stored without rowid when enabled.
 */
public class SqliteDdlBuilder {

    private final boolean withoutRowid;

    public SqliteDdlBuilder(boolean withoutRowid) {
        this.withoutRowid = withoutRowid;
    }

    public String createTable(Table table) {
        CreateTable createTable = new CreateTable();
        createTable.setTable(new net.sf.jsqlparser.schema.Table(quote(table.getName())));

        boolean singleKey = table.getPrimaryKey().size() == 1;
        List<ColumnDefinition> definitions = new ArrayList<>();
        for (Column column : table.getColumns()) {
            definitions.add(columnDefinition(column, singleKey && column.isPrimaryKey()));
        }
        createTable.setColumnDefinitions(definitions);

        if (table.hasCompositePrimaryKey()) {
            Index primaryKey = new Index();
            primaryKey.setType("PRIMARY KEY");
            primaryKey.setColumnsNames(table.getPrimaryKey().stream()
                    .map(SqliteDdlBuilder::quote)
                    .collect(Collectors.toList()));
            createTable.setIndexes(List.of(primaryKey));
        }

        if (withoutRowid && table.hasPrimaryKey()) {
            createTable.setTableOptionsStrings(List.of("WITHOUT", "ROWID"));
        }

        return createTable.toString();
    }

    private ColumnDefinition columnDefinition(Column column, boolean inlinePrimaryKey) {
        ColDataType dataType = new ColDataType();
        dataType.setDataType(sqliteType(column.getType()));

        List<String> specs = new ArrayList<>();
        if (!column.isNullable()) {
            specs.add("NOT NULL");
        }
        if (inlinePrimaryKey) {
            specs.add("PRIMARY KEY");
        }
        if (column.isEnumerated()) {
            specs.add("CHECK (" + quote(column.getName()) + " IN (" + column.getEnumDomain().stream()
                    .map(SqliteDdlBuilder::literal)
                    .collect(Collectors.joining(", ")) + "))");
        } else if (column.getType() == LogicalType.BOOLEAN) {
            specs.add("CHECK (" + quote(column.getName()) + " IN (0, 1))");
        }
        if (column.isForeignKey()) {
            ColumnReference reference = column.getForeignKey();
            specs.add("REFERENCES " + quote(reference.table()) + " (" + quote(reference.column()) + ")");
        }

        return new ColumnDefinition(quote(column.getName()), dataType, specs);
    }

    static String sqliteType(LogicalType type) {
        switch (type) {
            case DATE:
                return "DATE";
            case DATETIME:
                return "DATETIME";
            case BOOLEAN:
                return "BOOLEAN";
            case INTEGER:
                return "INTEGER";
            case DECIMAL:
                return "NUMERIC";
            case FLOAT:
                return "REAL";
            case BINARY:
                return "BLOB";
            case IDENTIFIER:
            case TEXT:
            default:
                return "TEXT";
        }
    }

    static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    static String literal(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
