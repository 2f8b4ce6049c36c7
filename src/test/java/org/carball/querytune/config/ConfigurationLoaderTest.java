package org.carball.querytune.config;

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
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    private ConfigurationLoader loader;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        loader = new ConfigurationLoader(Map.of());

        logger = (Logger) LoggerFactory.getLogger(ConfigurationLoader.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
    }

    @Test
    void shouldLoadDefaultConfiguration() {
        // When
        AnalyzerThresholds thresholds = loader.loadConfiguration(new String[0]);

        // Then
        assertThat(thresholds).isEqualTo(AnalyzerThresholds.defaults());
    }

    @Test
    void shouldApplyCliArguments() {
        // Given
        String[] args = {
                "--thresholds.slowness", "250.5",
                "--thresholds.frequency", "20",
                "--thresholds.cache", "false",
                "--thresholds.anomaly-min-samples", "5",
                "--thresholds.removal-benefit", "0.2",
                "--mode", "storage-constrained"
        };

        // When
        AnalyzerThresholds thresholds = loader.loadConfiguration(args);

        // Then
        assertThat(thresholds.getSlownessThreshold()).isEqualTo(250.5);
        assertThat(thresholds.getFrequencyThreshold()).isEqualTo(20);
        assertThat(thresholds.isCacheEnabled()).isFalse();
        assertThat(thresholds.getAnomalyMinSamples()).isEqualTo(5);
        assertThat(thresholds.getRemovalBenefitThreshold()).isEqualTo(0.2);
        assertThat(thresholds.getOperatingMode()).isEqualTo(OperatingMode.STORAGE_CONSTRAINED);
    }

    @Test
    void shouldApplyEnvironmentVariablesBelowCliArguments() {
        // Given
        loader = new ConfigurationLoader(Map.of(
                "QUERYTUNE_SLOWNESS_THRESHOLD", "300",
                "QUERYTUNE_SLOW_QUERY_MS", "250",
                "QUERYTUNE_OPERATING_MODE", "write-heavy",
                "PATH", "/usr/bin"));
        String[] args = {"--thresholds.slowness", "400"};

        // When
        AnalyzerThresholds thresholds = loader.loadConfiguration(args);

        // Then
        assertThat(thresholds.getSlownessThreshold()).isEqualTo(400.0);
        assertThat(thresholds.getSlowQueryThresholdMs()).isEqualTo(250);
        assertThat(thresholds.getOperatingMode()).isEqualTo(OperatingMode.WRITE_HEAVY);
    }

    @Test
    void shouldLoadYamlFileBelowEnvironmentAndCli() throws IOException {
        // Given
        Path file = tempDir.resolve("thresholds.yml");
        Files.writeString(file, String.join("\n",
                "slowness_threshold: 50.0",
                "frequency_threshold: 7",
                "cache_enabled: false",
                "operating_mode: read-heavy",
                "removal_usage_threshold: 3",
                "unrelated_key: ignored",
                ""));
        loader = new ConfigurationLoader(Map.of("QUERYTUNE_FREQUENCY_THRESHOLD", "9"));
        String[] args = {"--thresholds.removal-usage", "4"};

        // When
        AnalyzerThresholds thresholds = loader.loadConfiguration(file, args);

        // Then
        assertThat(thresholds.getSlownessThreshold()).isEqualTo(50.0);
        assertThat(thresholds.getFrequencyThreshold()).isEqualTo(9);
        assertThat(thresholds.isCacheEnabled()).isFalse();
        assertThat(thresholds.getOperatingMode()).isEqualTo(OperatingMode.READ_HEAVY);
        assertThat(thresholds.getRemovalUsageThreshold()).isEqualTo(4);
    }

    @Test
    void shouldWarnAndUseDefaultsWhenYamlFileMissing() {
        // When
        AnalyzerThresholds thresholds = loader.loadConfiguration(tempDir.resolve("missing.yml"), new String[0]);

        // Then
        assertThat(thresholds).isEqualTo(AnalyzerThresholds.defaults());
        assertThat(logAppender.list)
                .anySatisfy(event -> {
                    assertThat(event.getLevel()).isEqualTo(Level.WARN);
                    assertThat(event.getFormattedMessage()).startsWith("Threshold config file not found");
                });
    }

    @Test
    void shouldFailOnMalformedYaml() throws IOException {
        // Given
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "slowness_threshold: [not, a, number\n");

        // When/Then
        assertThatThrownBy(() -> loader.loadConfiguration(file, new String[0]))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("Failed to load threshold config");
    }

    @Test
    void shouldWarnAndKeepDefaultOnInvalidNumber() {
        // When
        AnalyzerThresholds thresholds = loader.loadConfiguration(new String[]{"--thresholds.frequency", "lots"});

        // Then
        assertThat(thresholds.getFrequencyThreshold()).isEqualTo(1);
        assertThat(logAppender.list)
                .anySatisfy(event -> assertThat(event.getFormattedMessage())
                        .isEqualTo("Invalid numeric value for --thresholds.frequency: lots"));
    }

    @Test
    void shouldLoadMode() {
        // When
        AnalyzerThresholds thresholds = loader.loadMode("read-heavy");

        // Then
        assertThat(thresholds.getOperatingMode()).isEqualTo(OperatingMode.READ_HEAVY);
    }

    @Test
    void shouldThrowExceptionForUnknownMode() {
        // When/Then
        assertThatThrownBy(() -> loader.loadMode("nonexistent"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown operating mode: nonexistent");
    }

    @Test
    void shouldDocumentOptionsInHelp() {
        // When
        String help = ConfigurationLoader.getThresholdHelp();

        // Then
        assertThat(help).contains("--thresholds.slowness", "QUERYTUNE_SLOWNESS_THRESHOLD", "--mode <name>");
    }
}
