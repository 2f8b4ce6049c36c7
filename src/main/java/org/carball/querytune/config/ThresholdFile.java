package org.carball.querytune.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * YAML view of {@link AnalyzerThresholds}. Keys left out of the file stay {@code null} and do not override.
 */
@Data
public class ThresholdFile {

    @JsonProperty("slowness_threshold")
    private Double slownessThreshold;

    @JsonProperty("frequency_threshold")
    private Long frequencyThreshold;

    @JsonProperty("cache_enabled")
    private Boolean cacheEnabled;

    @JsonProperty("slow_query_threshold_ms")
    private Long slowQueryThresholdMs;

    @JsonProperty("anomaly_history_size")
    private Integer anomalyHistorySize;

    @JsonProperty("anomaly_min_samples")
    private Integer anomalyMinSamples;

    @JsonProperty("anomaly_deviation_threshold")
    private Double anomalyDeviationThreshold;

    @JsonProperty("frequency_weight")
    private Double frequencyWeight;

    @JsonProperty("performance_weight")
    private Double performanceWeight;

    @JsonProperty("cost_weight")
    private Double costWeight;

    @JsonProperty("complexity_weight")
    private Double complexityWeight;

    @JsonProperty("operating_mode")
    private String operatingMode;

    @JsonProperty("removal_usage_threshold")
    private Long removalUsageThreshold;

    @JsonProperty("removal_unused_seconds")
    private Long removalUnusedSeconds;

    @JsonProperty("removal_benefit_threshold")
    private Double removalBenefitThreshold;

    void applyTo(AnalyzerThresholds.AnalyzerThresholdsBuilder builder) {
        if (slownessThreshold != null) builder.slownessThreshold(slownessThreshold);
        if (frequencyThreshold != null) builder.frequencyThreshold(frequencyThreshold);
        if (cacheEnabled != null) builder.cacheEnabled(cacheEnabled);
        if (slowQueryThresholdMs != null) builder.slowQueryThresholdMs(slowQueryThresholdMs);
        if (anomalyHistorySize != null) builder.anomalyHistorySize(anomalyHistorySize);
        if (anomalyMinSamples != null) builder.anomalyMinSamples(anomalyMinSamples);
        if (anomalyDeviationThreshold != null) builder.anomalyDeviationThreshold(anomalyDeviationThreshold);
        if (frequencyWeight != null) builder.frequencyWeight(frequencyWeight);
        if (performanceWeight != null) builder.performanceWeight(performanceWeight);
        if (costWeight != null) builder.costWeight(costWeight);
        if (complexityWeight != null) builder.complexityWeight(complexityWeight);
        if (operatingMode != null) builder.operatingMode(OperatingMode.fromName(operatingMode));
        if (removalUsageThreshold != null) builder.removalUsageThreshold(removalUsageThreshold);
        if (removalUnusedSeconds != null) builder.removalUnusedSeconds(removalUnusedSeconds);
        if (removalBenefitThreshold != null) builder.removalBenefitThreshold(removalBenefitThreshold);
    }
}
