package org.carball.dpm.converter;

import lombok.Data;

import java.nio.file.Path;

@Data
public class ConversionRequest {
    private Path source;
    private Path targetDirectory;
    private boolean overwrite;
    private boolean modelOnly;
    private boolean verbose;
}
