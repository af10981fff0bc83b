package org.carball.dpm.exception;

import java.nio.file.Path;

/**
 * Thrown when no source database can be located. Fatal for the run.
 */
public class DatabaseNotFoundException extends ConversionException {

    private final Path source;

    public DatabaseNotFoundException(Path source) {
        super("No source database found in " + source);
        this.source = source;
    }

    public Path source() {
        return source;
    }
}
