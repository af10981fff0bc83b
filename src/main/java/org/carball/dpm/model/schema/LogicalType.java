package org.carball.dpm.model.schema;

/**
 * Refined column type decided from naming conventions and the physical JDBC type.
 * <p>
 * Enumerated string domains are not a separate constant: a {@link #TEXT} column becomes
 * enumerated once the data scan attaches a domain to it.
 */
public enum LogicalType {
    IDENTIFIER,
    DATE,
    DATETIME,
    BOOLEAN,
    INTEGER,
    DECIMAL,
    FLOAT,
    TEXT,
    BINARY
}
