package org.carball.querytune.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Same as {@link #loadConfiguration(Path, String[])} without a threshold file: the YAML layer is
     * skipped and CLI args and env vars apply over the defaults.
     */
    public AnalyzerThresholds loadConfiguration(String[] args) {
        return loadConfiguration(null, args);
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > YAML file > defaults.
     * A missing file is logged and skipped; an unreadable one fails the load.
     */
    public AnalyzerThresholds loadConfiguration(Path thresholdFile, String[] args) {
        log.debug("Loading configuration");

        AnalyzerThresholds.AnalyzerThresholdsBuilder builder = AnalyzerThresholds.builder();

        // 1. YAML file
        if (thresholdFile != null) {
            applyThresholdFile(builder, thresholdFile);
        }

        // 2. Environment variables
        applyEnvironmentVariables(builder);

        // 3. CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        AnalyzerThresholds thresholds = builder.build();
        thresholds.validate();

        log.info("Configuration loaded: {}", thresholds.getConfigurationSummary());
        return thresholds;
    }

    /**
     * Default thresholds with the given operating mode selected.
     */
    public AnalyzerThresholds loadMode(String modeName) {
        try {
            OperatingMode mode = OperatingMode.fromName(modeName);
            AnalyzerThresholds thresholds = AnalyzerThresholds.builder().operatingMode(mode).build();
            log.info("Loaded mode '{}': {}", modeName, thresholds.getConfigurationSummary());
            return thresholds;
        } catch (IllegalArgumentException e) {
            log.error("Unknown mode: {}. {}", modeName, e.getMessage());
            throw e;
        }
    }

    private void applyThresholdFile(AnalyzerThresholds.AnalyzerThresholdsBuilder builder, Path thresholdFile) {
        if (!Files.exists(thresholdFile)) {
            log.warn("Threshold config file not found: {}, using defaults", thresholdFile);
            return;
        }

        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            ThresholdFile file = mapper.readValue(thresholdFile.toFile(), ThresholdFile.class);
            if (file == null) {
                log.warn("Threshold config file is empty: {}", thresholdFile);
                return;
            }
            file.applyTo(builder);
            log.info("Loaded threshold configuration from: {}", thresholdFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load threshold config from " + thresholdFile, e);
        }
    }

    private void applyEnvironmentVariables(AnalyzerThresholds.AnalyzerThresholdsBuilder builder) {
        for (Map.Entry<String, String> entry : environment.entrySet()) {
            String key = entry.getKey();
            String value = entry.getValue();
            if (!key.startsWith("QUERYTUNE_")) {
                continue;
            }

            try {
                switch (key) {
                    case "QUERYTUNE_SLOWNESS_THRESHOLD":
                        builder.slownessThreshold(Double.parseDouble(value));
                        break;
                    case "QUERYTUNE_FREQUENCY_THRESHOLD":
                        builder.frequencyThreshold(Long.parseLong(value));
                        break;
                    case "QUERYTUNE_CACHE_ENABLED":
                        builder.cacheEnabled(Boolean.parseBoolean(value));
                        break;
                    case "QUERYTUNE_SLOW_QUERY_MS":
                        builder.slowQueryThresholdMs(Long.parseLong(value));
                        break;
                    case "QUERYTUNE_OPERATING_MODE":
                        builder.operatingMode(OperatingMode.fromName(value));
                        break;
                    case "QUERYTUNE_REMOVAL_USAGE_THRESHOLD":
                        builder.removalUsageThreshold(Long.parseLong(value));
                        break;
                    case "QUERYTUNE_REMOVAL_UNUSED_SECONDS":
                        builder.removalUnusedSeconds(Long.parseLong(value));
                        break;
                    default:
                        log.debug("Ignoring unrecognised environment variable {}", key);
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", key, value);
            }
        }
    }

    private void applyCLIArguments(AnalyzerThresholds.AnalyzerThresholdsBuilder builder, String[] args) {
        if (args == null) {
            return;
        }

        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--thresholds.slowness":
                        builder.slownessThreshold(Double.parseDouble(value));
                        break;
                    case "--thresholds.frequency":
                        builder.frequencyThreshold(Long.parseLong(value));
                        break;
                    case "--thresholds.cache":
                        builder.cacheEnabled(Boolean.parseBoolean(value));
                        break;
                    case "--thresholds.slow-query-ms":
                        builder.slowQueryThresholdMs(Long.parseLong(value));
                        break;
                    case "--thresholds.anomaly-min-samples":
                        builder.anomalyMinSamples(Integer.parseInt(value));
                        break;
                    case "--thresholds.anomaly-deviation":
                        builder.anomalyDeviationThreshold(Double.parseDouble(value));
                        break;
                    case "--thresholds.frequency-weight":
                        builder.frequencyWeight(Double.parseDouble(value));
                        break;
                    case "--thresholds.performance-weight":
                        builder.performanceWeight(Double.parseDouble(value));
                        break;
                    case "--thresholds.cost-weight":
                        builder.costWeight(Double.parseDouble(value));
                        break;
                    case "--thresholds.complexity-weight":
                        builder.complexityWeight(Double.parseDouble(value));
                        break;
                    case "--thresholds.removal-usage":
                        builder.removalUsageThreshold(Long.parseLong(value));
                        break;
                    case "--thresholds.removal-unused-seconds":
                        builder.removalUnusedSeconds(Long.parseLong(value));
                        break;
                    case "--thresholds.removal-benefit":
                        builder.removalBenefitThreshold(Double.parseDouble(value));
                        break;
                    case "--mode":
                        builder.operatingMode(OperatingMode.fromName(value));
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    /**
     * Returns help text for threshold configuration options.
     */
    public static String getThresholdHelp() {
        return """
            Threshold Configuration Options:

            CLI Arguments:
              --thresholds.slowness <num>           Slowness score above which a pattern gets an index
              --thresholds.frequency <num>          Frequency above which a pattern gets an index
              --thresholds.cache <true|false>       Apply the cache factor to predictions
              --thresholds.slow-query-ms <num>      Execution time counted as slow
              --thresholds.anomaly-min-samples <num> History needed before anomaly detection runs
              --thresholds.anomaly-deviation <num>  Relative deviation from the median flagged as sudden slowdown
              --thresholds.frequency-weight <num>   Priority weight of query frequency
              --thresholds.performance-weight <num> Priority weight of performance impact
              --thresholds.cost-weight <num>        Priority weight of maintenance cost
              --thresholds.complexity-weight <num>  Priority weight of index complexity
              --thresholds.removal-usage <num>      Usage count below which an index is a removal candidate
              --thresholds.removal-unused-seconds <num> Idle time after which an index counts as unused
              --thresholds.removal-benefit <num>    Minimum benefit-to-maintenance ratio
              --mode <name>                         Operating mode (balanced, read-heavy, write-heavy, storage-constrained)

            Environment Variables:
              QUERYTUNE_SLOWNESS_THRESHOLD          Same as --thresholds.slowness
              QUERYTUNE_FREQUENCY_THRESHOLD         Same as --thresholds.frequency
              QUERYTUNE_CACHE_ENABLED               Same as --thresholds.cache
              QUERYTUNE_SLOW_QUERY_MS               Same as --thresholds.slow-query-ms
              QUERYTUNE_OPERATING_MODE              Same as --mode
              QUERYTUNE_REMOVAL_USAGE_THRESHOLD     Same as --thresholds.removal-usage
              QUERYTUNE_REMOVAL_UNUSED_SECONDS      Same as --thresholds.removal-unused-seconds

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. YAML threshold file
              4. Built-in defaults
            """;
    }
}
