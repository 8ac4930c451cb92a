package org.carball.fathom.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Contents of {@code fathom-config.yml}. Absent keys leave the built-in defaults in place.
 */
@Data
public class SettingsFile {

    @JsonProperty("verbosity")
    private Integer verbosity;

    @JsonProperty("output_format")
    private String outputFormat;

    @JsonProperty("output_file")
    private String outputFile;
}
