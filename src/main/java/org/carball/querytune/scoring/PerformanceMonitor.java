package org.carball.querytune.scoring;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.carball.querytune.model.analysis.AlertSeverity;
import org.carball.querytune.model.analysis.MetricTrend;
import org.carball.querytune.model.analysis.MonitorSummary;
import org.carball.querytune.model.analysis.PerformanceAlert;
import org.carball.querytune.model.analysis.PerformanceMetric;

import java.time.Clock;
import java.util.*;

/**
 * Keeps a bounded history per named metric and raises alerts when the latest sample of a metric
 * exceeds its threshold.
 */
@Slf4j
public class PerformanceMonitor {

    public static final String QUERY_TIME = "query_time";
    public static final String CPU_USAGE = "cpu_usage";
    public static final String MEMORY_USAGE = "memory_usage";
    public static final String CONNECTION_COUNT = "connection_count";

    public static final int DEFAULT_MAX_HISTORY_SIZE = 1000;

    private static final int TREND_MIN_SAMPLES = 10;
    private static final int TREND_WINDOW = 5;
    private static final double TREND_CHANGE_PERCENT = 20.0;
    private static final int PREDICTION_MIN_SAMPLES = 20;

    private final Map<String, Deque<PerformanceMetric>> metricsHistory = new TreeMap<>();
    private final Map<String, Double> alertThresholds = new HashMap<>();
    private final int maxHistorySize;
    private final Clock clock;

    public PerformanceMonitor() {
        this(DEFAULT_MAX_HISTORY_SIZE, Clock.systemUTC());
    }

    public PerformanceMonitor(int maxHistorySize, Clock clock) {
        this.maxHistorySize = maxHistorySize;
        this.clock = clock;
        alertThresholds.put(QUERY_TIME, 1000.0);
        alertThresholds.put(CPU_USAGE, 80.0);
        alertThresholds.put(MEMORY_USAGE, 90.0);
        alertThresholds.put(CONNECTION_COUNT, 100.0);
    }

    public void setAlertThreshold(String metricName, double threshold) {
        alertThresholds.put(metricName, threshold);
    }

    public OptionalDouble getAlertThreshold(String metricName) {
        Double threshold = alertThresholds.get(metricName);
        return threshold == null ? OptionalDouble.empty() : OptionalDouble.of(threshold);
    }

    public void recordMetric(PerformanceMetric metric) {
        Deque<PerformanceMetric> history = metricsHistory.computeIfAbsent(metric.metricName(), k -> new ArrayDeque<>());
        history.addLast(metric);
        if (history.size() > maxHistorySize) {
            history.removeFirst();
        }
    }

    /**
     * Records a sample stamped with the current time and graded against the metric's threshold;
     * metrics without a threshold are always normal.
     */
    public void recordMetric(String metricName, double value, String unit) {
        AlertSeverity severity = alertThresholds.containsKey(metricName)
                ? AlertSeverity.fromRatio(value / alertThresholds.get(metricName))
                : AlertSeverity.NORMAL;
        recordMetric(new PerformanceMetric(clock.instant().getEpochSecond(), metricName, value, unit, severity));
    }

    /**
     * One alert per thresholded metric whose latest sample is above the threshold, in metric name order.
     */
    public List<PerformanceAlert> checkAlerts() {
        long nowSeconds = clock.instant().getEpochSecond();
        List<PerformanceAlert> alerts = new ArrayList<>();

        metricsHistory.forEach((metricName, history) -> {
            Double threshold = alertThresholds.get(metricName);
            if (threshold == null || history.isEmpty()) {
                return;
            }
            double latest = history.getLast().value();
            if (latest > threshold) {
                alerts.add(new PerformanceAlert(
                        metricName + "_" + nowSeconds,
                        metricName,
                        latest,
                        threshold,
                        AlertSeverity.fromRatio(latest / threshold),
                        String.format("%s exceeded threshold: %.1f > %.1f", metricName, latest, threshold),
                        nowSeconds));
            }
        });

        if (!alerts.isEmpty()) {
            log.debug("{} metric(s) above their alert threshold", alerts.size());
        }
        return alerts;
    }

    /**
     * Trend per metric with at least ten samples: the mean of the five latest against the five before them.
     */
    public Map<String, MetricTrend> getPerformanceTrends() {
        Map<String, MetricTrend> trends = new TreeMap<>();
        metricsHistory.forEach((metricName, history) -> {
            if (history.size() >= TREND_MIN_SAMPLES) {
                trends.put(metricName, calculateTrend(latestValues(history, 2 * TREND_WINDOW)));
            }
        });
        return trends;
    }

    private MetricTrend calculateTrend(double[] lastTen) {
        double olderAvg = Arrays.stream(lastTen, 0, TREND_WINDOW).average().orElse(0.0);
        double recentAvg = Arrays.stream(lastTen, TREND_WINDOW, lastTen.length).average().orElse(0.0);

        if (olderAvg == 0.0) {
            return recentAvg > 0.0 ? MetricTrend.INCREASING : MetricTrend.STABLE;
        }

        double changePercent = (recentAvg - olderAvg) / olderAvg * 100.0;
        if (changePercent > TREND_CHANGE_PERCENT) {
            return MetricTrend.INCREASING;
        }
        if (changePercent < -TREND_CHANGE_PERCENT) {
            return MetricTrend.DECREASING;
        }
        return MetricTrend.STABLE;
    }

    public MonitorSummary getPerformanceSummary() {
        if (metricsHistory.isEmpty()) {
            return MonitorSummary.EMPTY;
        }

        double healthScore = metricsHistory.values().stream()
                .mapToDouble(history -> 100.0 * history.stream()
                        .filter(metric -> metric.severity() == AlertSeverity.NORMAL)
                        .count() / history.size())
                .average()
                .orElse(0.0);

        List<PerformanceAlert> alerts = checkAlerts();
        int critical = (int) alerts.stream().filter(alert -> alert.severity() == AlertSeverity.CRITICAL).count();
        return new MonitorSummary(healthScore, alerts.size(), critical);
    }

    /**
     * Extrapolates the least-squares slope of the twenty latest samples {@code stepsAhead} samples past
     * the latest one. Empty when the metric has fewer than twenty samples.
     */
    public OptionalDouble predictPerformance(String metricName, int stepsAhead) {
        Deque<PerformanceMetric> history = metricsHistory.get(metricName);
        if (history == null || history.size() < PREDICTION_MIN_SAMPLES) {
            return OptionalDouble.empty();
        }

        double[] values = latestValues(history, PREDICTION_MIN_SAMPLES);
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < values.length; i++) {
            regression.addData(i, values[i]);
        }

        double current = values[values.length - 1];
        return OptionalDouble.of(current + regression.getSlope() * stepsAhead);
    }

    public int historySize(String metricName) {
        Deque<PerformanceMetric> history = metricsHistory.get(metricName);
        return history == null ? 0 : history.size();
    }

    public void clear() {
        metricsHistory.clear();
    }

    /**
     * Up to {@code count} latest values, oldest first.
     */
    private static double[] latestValues(Deque<PerformanceMetric> history, int count) {
        return history.stream()
                .skip(Math.max(history.size() - count, 0))
                .mapToDouble(PerformanceMetric::value)
                .toArray();
    }
}
