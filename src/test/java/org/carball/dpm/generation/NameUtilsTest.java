package org.carball.dpm.generation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NameUtilsTest {

    @Test
    void shouldSplitWordsAtCaseBoundaries() {
        assertThat(NameUtils.toSnakeCase("ConceptGUID")).isEqualTo("concept_guid");
        assertThat(NameUtils.toSnakeCase("HTMLCode")).isEqualTo("html_code");
        assertThat(NameUtils.toSnakeCase("Table Version-ID")).isEqualTo("table_version_id");
    }

    @Test
    void shouldConvertToJavaCasing() {
        assertThat(NameUtils.toCamelCase("ParentItemID")).isEqualTo("parentItemId");
        assertThat(NameUtils.toPascalCase("data_point_version")).isEqualTo("DataPointVersion");
        assertThat(NameUtils.toPascalCase("2ndLevel")).isEqualTo("_2ndLevel");
    }

    @Test
    void shouldDeriveEnumConstants() {
        assertThat(NameUtils.toConstantName("Non-negative")).isEqualTo("NON_NEGATIVE");
        assertThat(NameUtils.toConstantName("")).isEqualTo("EMPTY");
        assertThat(NameUtils.toConstantName("1")).isEqualTo("_1");
    }

    @Test
    void shouldEscapeJavaKeywords() {
        assertThat(NameUtils.escapeKeyword("class")).isEqualTo("class_");
        assertThat(NameUtils.escapeKeyword("default")).isEqualTo("default_");
        assertThat(NameUtils.escapeKeyword("item")).isEqualTo("item");
    }

    @Test
    void shouldPluralizeRegularNouns() {
        assertThat(NameUtils.pluralize("Item")).isEqualTo("Items");
        assertThat(NameUtils.pluralize("Taxonomy")).isEqualTo("Taxonomies");
        assertThat(NameUtils.pluralize("Key")).isEqualTo("Keys");
        assertThat(NameUtils.pluralize("Class")).isEqualTo("Classes");
        assertThat(NameUtils.pluralize("Box")).isEqualTo("Boxes");
    }
}
