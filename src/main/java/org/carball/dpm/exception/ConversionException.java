package org.carball.dpm.exception;

/**
 * Base class for failures raised while converting a source database.
 */
public class ConversionException extends RuntimeException {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
