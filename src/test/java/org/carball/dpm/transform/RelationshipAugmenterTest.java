package org.carball.dpm.transform;

import org.carball.dpm.model.schema.Column;
import org.carball.dpm.model.schema.ColumnReference;
import org.carball.dpm.model.schema.DatabaseSchema;
import org.carball.dpm.model.schema.LogicalType;
import org.carball.dpm.model.schema.Table;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class RelationshipAugmenterTest {

    private RelationshipAugmenter augmenter;

    @BeforeEach
    void setUp() {
        augmenter = new RelationshipAugmenter(Map.of(
                "RowGUID", "Concept.ConceptGUID",
                "ParentItemID", "Item.ItemID"));
    }

    @Test
    public void shouldAddConventionalForeignKeys() {
        // Given
        DatabaseSchema schema = new DatabaseSchema(List.of(concept(), framework(null)));

        // When
        DatabaseSchema augmented = augmenter.augment(schema);

        // Then
        Column rowGuid = augmented.getTable("Framework").findColumn("RowGUID").orElseThrow();
        assertThat(rowGuid.getForeignKey()).isEqualTo(new ColumnReference("Concept", "ConceptGUID", true));
        assertThat(augmented.dependenciesOf("Framework")).containsExactly("Concept");
    }

    @Test
    public void shouldNeverOverwriteDeclaredForeignKey() {
        // Given
        ColumnReference declared = ColumnReference.declared("Other", "OtherGUID");
        DatabaseSchema schema = new DatabaseSchema(List.of(concept(), framework(declared)));

        // When
        DatabaseSchema augmented = augmenter.augment(schema);

        // Then
        assertThat(augmented.getTable("Framework").findColumn("RowGUID").orElseThrow().getForeignKey())
                .isEqualTo(declared);
    }

    @Test
    public void shouldBeIdempotent() {
        // Given
        DatabaseSchema schema = new DatabaseSchema(List.of(concept(), framework(null)));

        // When
        DatabaseSchema once = augmenter.augment(schema);
        DatabaseSchema twice = augmenter.augment(once);

        // Then
        assertThat(twice.getTables()).isEqualTo(once.getTables());
    }

    @Test
    public void shouldSkipMappingsWhoseTargetIsMissing() {
        // Given - no Concept table
        DatabaseSchema schema = new DatabaseSchema(List.of(framework(null)));

        // When
        DatabaseSchema augmented = augmenter.augment(schema);

        // Then
        assertThat(augmented.getTable("Framework").findColumn("RowGUID").orElseThrow().isForeignKey()).isFalse();
    }

    @Test
    public void shouldResolveTargetSpelling() {
        // Given
        Table item = Table.builder()
                .name("ITEM")
                .column(Column.builder().name("itemid").type(LogicalType.INTEGER).primaryKey(true).build())
                .column(Column.builder().name("ParentItemID").type(LogicalType.INTEGER).nullable(true).build())
                .primaryKeyColumn("itemid")
                .build();

        // When
        DatabaseSchema augmented = augmenter.augment(new DatabaseSchema(List.of(item)));

        // Then
        assertThat(augmented.getTable("ITEM").findColumn("ParentItemID").orElseThrow().getForeignKey())
                .isEqualTo(new ColumnReference("ITEM", "itemid", true));
    }

    private static Table concept() {
        return Table.builder()
                .name("Concept")
                .column(Column.builder().name("ConceptGUID").type(LogicalType.IDENTIFIER).primaryKey(true).build())
                .primaryKeyColumn("ConceptGUID")
                .build();
    }

    private static Table framework(ColumnReference rowGuidReference) {
        return Table.builder()
                .name("Framework")
                .column(Column.builder().name("FrameworkID").type(LogicalType.INTEGER).primaryKey(true).build())
                .column(Column.builder().name("RowGUID").type(LogicalType.IDENTIFIER).foreignKey(rowGuidReference).build())
                .primaryKeyColumn("FrameworkID")
                .build();
    }
}
