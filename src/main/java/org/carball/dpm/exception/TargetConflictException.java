package org.carball.dpm.exception;

import java.nio.file.Path;

/**
 * Thrown when the target artifact already exists and overwriting was not requested.
 * The existing file is left untouched.
 */
public class TargetConflictException extends ConversionException {

    private final Path target;

    public TargetConflictException(Path target) {
        super("Target already exists: " + target + " (use --overwrite to replace it)");
        this.target = target;
    }

    public Path target() {
        return target;
    }
}
