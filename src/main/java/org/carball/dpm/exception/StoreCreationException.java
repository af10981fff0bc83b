package org.carball.dpm.exception;

public class StoreCreationException extends ConversionException {

    public StoreCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
