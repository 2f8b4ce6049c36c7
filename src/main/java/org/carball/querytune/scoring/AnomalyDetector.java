package org.carball.querytune.scoring;

import lombok.extern.slf4j.Slf4j;
import org.carball.querytune.analyzer.ExecutionTimeHistory;
import org.carball.querytune.model.analysis.AnomalyResult;
import org.carball.querytune.model.analysis.AnomalySummary;
import org.carball.querytune.model.analysis.AnomalyType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Flags execution times that stand out against the median of the recent history.
 */
@Slf4j
public class AnomalyDetector {

    public static final int DEFAULT_MIN_SAMPLES = 10;
    public static final double DEFAULT_DEVIATION_THRESHOLD = 2.0;

    private static final int RECENT_WINDOW = 5;
    private static final int PRECEDING_WINDOW = 10;
    private static final double TREND_CHANGE_THRESHOLD = 0.5;
    private static final double UNUSUAL_PATTERN_SEVERITY = 0.7;

    private static final double HIGH_ANOMALY_RATE = 0.1;
    private static final double HIGH_AVG_EXECUTION_MS = 200.0;
    private static final long MANY_ANOMALIES = 5;

    private final ExecutionTimeHistory history;
    private final int minSamples;
    private final double deviationThreshold;

    public AnomalyDetector() {
        this(ExecutionTimeHistory.DEFAULT_CAPACITY, DEFAULT_MIN_SAMPLES, DEFAULT_DEVIATION_THRESHOLD);
    }

    public AnomalyDetector(int historySize, int minSamples, double deviationThreshold) {
        this.history = new ExecutionTimeHistory(historySize);
        this.minSamples = minSamples;
        this.deviationThreshold = deviationThreshold;
    }

    public void recordExecutionTime(long executionTimeMs) {
        history.add(executionTimeMs);
    }

    /**
     * Judges {@code currentTimeMs} against the history without adding it.
     */
    public AnomalyResult detectAnomaly(long currentTimeMs) {
        if (history.size() < minSamples) {
            return new AnomalyResult(false, AnomalyType.INSUFFICIENT_DATA, 0.0,
                    "Not enough historical data for anomaly detection", 0.0, currentTimeMs);
        }

        double baseline = history.median();
        if (baseline <= 0.0) {
            return normal(baseline, currentTimeMs);
        }

        double deviation = (currentTimeMs - baseline) / baseline;
        if (deviation > deviationThreshold) {
            log.debug("Execution time {} ms deviates {}x from baseline {} ms", currentTimeMs, deviation, baseline);
            return new AnomalyResult(true, AnomalyType.SUDDEN_SLOW,
                    Math.min(deviation / deviationThreshold, 1.0),
                    String.format("Query execution time increased by %.1f%% from baseline", deviation * 100.0),
                    baseline, currentTimeMs);
        }

        if (hasUnusualTrend()) {
            return new AnomalyResult(true, AnomalyType.UNUSUAL_PATTERN, UNUSUAL_PATTERN_SEVERITY,
                    "Unusual execution pattern detected", baseline, currentTimeMs);
        }

        return normal(baseline, currentTimeMs);
    }

    private AnomalyResult normal(double baseline, long currentTimeMs) {
        return new AnomalyResult(false, AnomalyType.NORMAL, 0.0,
                "Query performance within normal range", baseline, currentTimeMs);
    }

    /**
     * Compares the mean of the five most recent samples with the mean of up to ten samples before them.
     */
    private boolean hasUnusualTrend() {
        double[] recent = history.recent(RECENT_WINDOW);
        double[] preceding = history.preceding(RECENT_WINDOW, PRECEDING_WINDOW);
        if (recent.length == 0 || preceding.length == 0) {
            return false;
        }

        double recentAvg = Arrays.stream(recent).average().orElse(0.0);
        double precedingAvg = Arrays.stream(preceding).average().orElse(0.0);
        if (precedingAvg <= 0.0) {
            return false;
        }
        return Math.abs((recentAvg - precedingAvg) / precedingAvg) > TREND_CHANGE_THRESHOLD;
    }

    public AnomalySummary getAnomalySummary() {
        if (history.isEmpty()) {
            return AnomalySummary.EMPTY;
        }

        double baseline = history.median();
        long anomalies = baseline <= 0.0 ? 0 : Arrays.stream(history.values())
                .filter(time -> (time - baseline) / baseline > deviationThreshold)
                .count();

        return new AnomalySummary(anomalies, (double) anomalies / history.size(), history.mean());
    }

    public List<String> getPerformanceRecommendations() {
        List<String> recommendations = new ArrayList<>();
        AnomalySummary summary = getAnomalySummary();

        if (summary.anomalyRate() > HIGH_ANOMALY_RATE) {
            recommendations.add(String.format("High anomaly rate detected (%.1f%%) - investigate query patterns",
                    summary.anomalyRate() * 100.0));
        }
        if (summary.avgExecutionTimeMs() > HIGH_AVG_EXECUTION_MS) {
            recommendations.add("Average execution time is high - consider query optimization");
        }
        if (summary.anomalyCount() > MANY_ANOMALIES) {
            recommendations.add("Multiple anomalies detected - review database configuration");
        }

        return recommendations;
    }

    public int historySize() {
        return history.size();
    }

    public void clear() {
        history.clear();
    }
}
