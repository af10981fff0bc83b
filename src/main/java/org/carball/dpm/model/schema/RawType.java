package org.carball.dpm.model.schema;

/**
 * Physical type of a column as reported by the source driver.
 */
public record RawType(int jdbcType, String typeName) {

    @Override
    public String toString() {
        return typeName + "(" + jdbcType + ")";
    }
}
