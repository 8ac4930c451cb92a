package org.carball.fathom.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(ConfigurationLoader.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
    }

    private Path configFile(String yaml) throws IOException {
        Path file = tempDir.resolve("fathom-config.yml");
        Files.writeString(file, yaml);
        return file;
    }

    private boolean warned(String fragment) {
        return logAppender.list.stream().anyMatch(event ->
                event.getLevel() == Level.WARN && event.getFormattedMessage().contains(fragment));
    }

    @Test
    void shouldUseDefaultsWhenNothingIsConfigured() {
        ConfigurationLoader loader = new ConfigurationLoader(Map.of());

        FathomConfig config = loader.loadConfiguration(tempDir.resolve("absent.yml"));

        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.TEXT);
        assertThat(config.getVerbosity()).isZero();
        assertThat(config.getOutputFile()).isNull();
        assertThat(warned("Config file not found")).isTrue();
    }

    @Test
    void shouldReadSettingsFromYamlFile() throws IOException {
        Path file = configFile("""
            verbosity: 1
            output_format: json
            output_file: report.json
            """);

        FathomConfig config = new ConfigurationLoader(Map.of()).loadConfiguration(file);

        assertThat(config.getVerbosity()).isEqualTo(1);
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.JSON);
        assertThat(config.getOutputFile()).isEqualTo("report.json");
    }

    @Test
    void shouldLetEnvironmentOverrideFile() throws IOException {
        Path file = configFile("""
            verbosity: 1
            output_format: json
            """);
        ConfigurationLoader loader = new ConfigurationLoader(Map.of(
                ConfigurationLoader.ENV_VERBOSITY, "2",
                ConfigurationLoader.ENV_OUTPUT_FORMAT, "both"));

        FathomConfig config = loader.loadConfiguration(file);

        assertThat(config.getVerbosity()).isEqualTo(2);
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.BOTH);
    }

    @Test
    void shouldIgnoreInvalidEnvironmentValues() {
        ConfigurationLoader loader = new ConfigurationLoader(Map.of(
                ConfigurationLoader.ENV_VERBOSITY, "loud",
                ConfigurationLoader.ENV_OUTPUT_FORMAT, "xml"));

        FathomConfig config = loader.loadConfiguration(tempDir.resolve("absent.yml"));

        assertThat(config.getVerbosity()).isZero();
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.TEXT);
        assertThat(warned("Invalid numeric value for FATHOM_VERBOSITY: loud")).isTrue();
        assertThat(warned("Invalid output format 'xml'")).isTrue();
    }

    @Test
    void shouldRejectNegativeVerbosity() {
        ConfigurationLoader loader = new ConfigurationLoader(Map.of(ConfigurationLoader.ENV_VERBOSITY, "-1"));

        assertThatThrownBy(() -> loader.loadConfiguration(tempDir.resolve("absent.yml")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must not be negative");
    }

    @Test
    void shouldFallBackToDefaultsOnUnreadableFile() throws IOException {
        Path file = configFile("verbosity: [not, a, number]\n");

        FathomConfig config = new ConfigurationLoader(Map.of()).loadConfiguration(file);

        assertThat(config.getVerbosity()).isZero();
        assertThat(logAppender.list).anyMatch(event -> event.getLevel() == Level.ERROR);
    }
}
