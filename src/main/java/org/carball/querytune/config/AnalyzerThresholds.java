package org.carball.querytune.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

@Data
@Builder(toBuilder = true)
@Slf4j
public class AnalyzerThresholds {

    // Index recommendation
    @Builder.Default
    private double slownessThreshold = 100.0;

    @Builder.Default
    private long frequencyThreshold = 1;

    // Performance prediction
    @Builder.Default
    private boolean cacheEnabled = true;

    // Slow query classification
    @Builder.Default
    private long slowQueryThresholdMs = 100;

    // Anomaly detection
    @Builder.Default
    private int anomalyHistorySize = 100;

    @Builder.Default
    private int anomalyMinSamples = 10;

    @Builder.Default
    private double anomalyDeviationThreshold = 2.0;

    // Priority weights
    @Builder.Default
    private double frequencyWeight = 0.3;

    @Builder.Default
    private double performanceWeight = 0.4;

    @Builder.Default
    private double costWeight = 0.2;

    @Builder.Default
    private double complexityWeight = 0.1;

    @Builder.Default
    private OperatingMode operatingMode = OperatingMode.BALANCED;

    // Index removal
    @Builder.Default
    private long removalUsageThreshold = 10;

    @Builder.Default
    private long removalUnusedSeconds = 86400L * 30;

    @Builder.Default
    private double removalBenefitThreshold = 0.1;

    // Result sizes
    @Builder.Default
    private int topColumnsLimit = 10;

    @Builder.Default
    private int frequentJoinsLimit = 10;

    /**
     * Creates default thresholds suitable for most workloads.
     */
    public static AnalyzerThresholds defaults() {
        return AnalyzerThresholds.builder().build();
    }

    /**
     * Validates the threshold configuration and logs warnings for potentially problematic values.
     */
    public void validate() {
        if (slownessThreshold <= 0) {
            log.warn("Slowness threshold ({}) should be positive", slownessThreshold);
        }

        if (frequencyThreshold < 0) {
            log.warn("Frequency threshold ({}) should not be negative", frequencyThreshold);
        }

        if (anomalyMinSamples > anomalyHistorySize) {
            log.warn("Anomaly minimum samples ({}) exceeds history size ({}); detection will never run",
                    anomalyMinSamples, anomalyHistorySize);
        }

        if (anomalyDeviationThreshold <= 0) {
            log.warn("Anomaly deviation threshold ({}) should be positive", anomalyDeviationThreshold);
        }

        double weightSum = frequencyWeight + performanceWeight + costWeight + complexityWeight;
        if (Math.abs(weightSum - 1.0) > 0.001) {
            log.warn("Priority weights sum to {} instead of 1.0", String.format("%.2f", weightSum));
        }

        if (removalBenefitThreshold < 0 || removalBenefitThreshold > 1) {
            log.warn("Removal benefit threshold ({}) should be between 0 and 1", removalBenefitThreshold);
        }

        if (removalUnusedSeconds <= 0) {
            log.warn("Removal unused window ({}s) should be positive", removalUnusedSeconds);
        }

        log.debug("Using thresholds - Slowness: {}, Frequency: {}, Cache: {}, Mode: {}",
                slownessThreshold, frequencyThreshold, cacheEnabled, operatingMode.getName());
    }

    /**
     * Returns a description of the current configuration for user feedback.
     */
    public String getConfigurationSummary() {
        return String.format("Mode: %s | Slowness: %.1f | Frequency: %d | Cache: %s | Slow query: %dms | Weights: %.2f/%.2f/%.2f/%.2f",
                operatingMode.getName(), slownessThreshold, frequencyThreshold, cacheEnabled ? "on" : "off",
                slowQueryThresholdMs, frequencyWeight, performanceWeight, costWeight, complexityWeight);
    }
}
