package org.carball.dpm.exception;

/**
 * Thrown when reading or casting one table's rows fails. The converter logs it and
 * skips that table's data.
 */
public class ExtractionException extends ConversionException {

    private final String tableName;

    public ExtractionException(String tableName, Throwable cause) {
        super("Failed to extract data from table " + tableName + ": " + cause.getMessage(), cause);
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }
}
