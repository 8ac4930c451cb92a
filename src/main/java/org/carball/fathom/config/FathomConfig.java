package org.carball.fathom.config;

import lombok.Data;
import java.nio.file.Path;

@Data
public class FathomConfig {
    private Path inputFile;
    private String outputFile;
    private OutputFormat outputFormat = OutputFormat.TEXT;
    private int verbosity;
}
