package org.carball.fathom.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    public static final String DEFAULT_CONFIG_FILE = "fathom-config.yml";
    public static final String ENV_VERBOSITY = "FATHOM_VERBOSITY";
    public static final String ENV_OUTPUT_FORMAT = "FATHOM_OUTPUT_FORMAT";

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: env vars > config file > defaults.
     * Command-line flags are applied on top by the caller.
     *
     * @param configFile explicit config file, or null to look for {@value #DEFAULT_CONFIG_FILE}
     */
    public FathomConfig loadConfiguration(Path configFile) {
        log.debug("Loading configuration");
        FathomConfig config = new FathomConfig();

        // 1. Config file
        Path effectiveFile = configFile != null ? configFile : Paths.get(DEFAULT_CONFIG_FILE);
        applySettingsFile(config, effectiveFile, configFile != null);

        // 2. Environment variables
        applyEnvironmentVariables(config);

        validate(config);
        log.debug("Configuration loaded: format={}, verbosity={}", config.getOutputFormat(), config.getVerbosity());
        return config;
    }

    public static void validate(FathomConfig config) {
        if (config.getVerbosity() < 0) {
            throw new IllegalArgumentException("Verbosity must not be negative: " + config.getVerbosity());
        }
    }

    private void applySettingsFile(FathomConfig config, Path file, boolean explicit) {
        if (!Files.exists(file)) {
            if (explicit) {
                log.warn("Config file not found: {}, using defaults", file);
            }
            return;
        }

        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            SettingsFile settings = mapper.readValue(file.toFile(), SettingsFile.class);
            if (settings == null) {
                return;
            }
            if (settings.getVerbosity() != null) {
                config.setVerbosity(settings.getVerbosity());
            }
            if (settings.getOutputFormat() != null) {
                config.setOutputFormat(OutputFormat.fromName(settings.getOutputFormat()));
            }
            if (settings.getOutputFile() != null) {
                config.setOutputFile(settings.getOutputFile());
            }
            log.info("Loaded configuration from: {}", file);
        } catch (IOException e) {
            log.error("Failed to load config from {}: {}, using defaults", file, e.getMessage());
        }
    }

    private void applyEnvironmentVariables(FathomConfig config) {
        String verbosity = environment.get(ENV_VERBOSITY);
        if (verbosity != null) {
            try {
                config.setVerbosity(Integer.parseInt(verbosity.trim()));
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", ENV_VERBOSITY, verbosity);
            }
        }

        String format = environment.get(ENV_OUTPUT_FORMAT);
        if (format != null) {
            try {
                config.setOutputFormat(OutputFormat.fromName(format));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring {}: {}", ENV_OUTPUT_FORMAT, e.getMessage());
            }
        }
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Configuration:

            Config file (fathom-config.yml in the working directory, or --config <file>):
              verbosity: 1
              output_format: json
              output_file: report.json

            Environment Variables:
              FATHOM_VERBOSITY         Same as --verbosity
              FATHOM_OUTPUT_FORMAT     Same as --format

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Config file
              4. Built-in defaults
            """;
    }
}
