package org.carball.dpm.exception;

public class ModelGenerationException extends ConversionException {

    public ModelGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
