package org.carball.dpm.target;

import org.carball.dpm.model.schema.Column;
import org.carball.dpm.model.schema.ColumnReference;
import org.carball.dpm.model.schema.LogicalType;
import org.carball.dpm.model.schema.Table;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;

class SqliteDdlBuilderTest {

    @Test
    void shouldRenderConstraintsForRefinedColumns() {
        // Given
        Table table = Table.builder()
                .name("Item")
                .column(column("ItemID", LogicalType.INTEGER, false).primaryKey(true).build())
                .column(column("ItemType", LogicalType.TEXT, false)
                        .enumDomain(new TreeSet<>(List.of("Metric", "Dimension")))
                        .build())
                .column(column("IsAbstract", LogicalType.BOOLEAN, true).build())
                .column(column("CategoryGUID", LogicalType.IDENTIFIER, true)
                        .foreignKey(ColumnReference.declared("Category", "CategoryGUID"))
                        .build())
                .primaryKeyColumn("ItemID")
                .build();

        // When
        String ddl = new SqliteDdlBuilder(false).createTable(table);

        // Then
        assertThat(ddl).startsWith("CREATE TABLE \"Item\"");
        assertThat(ddl).contains("\"ItemID\" INTEGER NOT NULL PRIMARY KEY");
        assertThat(ddl).contains("\"ItemType\" TEXT NOT NULL CHECK (\"ItemType\" IN ('Dimension', 'Metric'))");
        assertThat(ddl).contains("\"IsAbstract\" BOOLEAN CHECK (\"IsAbstract\" IN (0, 1))");
        assertThat(ddl).contains("\"CategoryGUID\" TEXT REFERENCES \"Category\" (\"CategoryGUID\")");
        assertThat(ddl).doesNotContain("WITHOUT ROWID");
    }

    @Test
    void shouldDeclareCompositeKeyAsTableConstraint() {
        // Given
        Table table = Table.builder()
                .name("Mapping")
                .column(column("SourceID", LogicalType.INTEGER, false).primaryKey(true).build())
                .column(column("TargetID", LogicalType.INTEGER, false).primaryKey(true).build())
                .primaryKeyColumn("SourceID")
                .primaryKeyColumn("TargetID")
                .build();

        // When
        String ddl = new SqliteDdlBuilder(true).createTable(table);

        // Then
        assertThat(ddl).contains("PRIMARY KEY (\"SourceID\", \"TargetID\")");
        assertThat(ddl).doesNotContain("INTEGER NOT NULL PRIMARY KEY");
        assertThat(ddl).endsWith("WITHOUT ROWID");
    }

    @Test
    void shouldKeepRowidForKeylessTables() {
        // Given
        Table table = Table.builder()
                .name("Log")
                .column(column("Message", LogicalType.TEXT, true).build())
                .build();

        // When
        String ddl = new SqliteDdlBuilder(true).createTable(table);

        // Then
        assertThat(ddl).doesNotContain("WITHOUT ROWID").doesNotContain("PRIMARY KEY");
    }

    @Test
    void shouldEscapeQuotesInIdentifiersAndLiterals() {
        assertThat(SqliteDdlBuilder.quote("Odd\"Name")).isEqualTo("\"Odd\"\"Name\"");
        assertThat(SqliteDdlBuilder.literal("O'Brien")).isEqualTo("'O''Brien'");
    }

    @Test
    void shouldMapLogicalTypesToStorageClasses() {
        assertThat(SqliteDdlBuilder.sqliteType(LogicalType.IDENTIFIER)).isEqualTo("TEXT");
        assertThat(SqliteDdlBuilder.sqliteType(LogicalType.DECIMAL)).isEqualTo("NUMERIC");
        assertThat(SqliteDdlBuilder.sqliteType(LogicalType.FLOAT)).isEqualTo("REAL");
        assertThat(SqliteDdlBuilder.sqliteType(LogicalType.BINARY)).isEqualTo("BLOB");
    }

    private static Column.ColumnBuilder column(String name, LogicalType type, boolean nullable) {
        return Column.builder().name(name).type(type).nullable(nullable);
    }
}
