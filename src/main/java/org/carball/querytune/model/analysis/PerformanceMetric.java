package org.carball.querytune.model.analysis;

/**
 * One sampled value of a named metric.
 *
 * @param timestamp  Unix epoch seconds
 * @param metricName metric key, such as {@code query_time} or {@code cpu_usage}
 * @param value      sampled value
 * @param unit       unit label, such as {@code ms} or {@code %}
 * @param severity   grade of the value when it was recorded
 */
public record PerformanceMetric(
        long timestamp,
        String metricName,
        double value,
        String unit,
        AlertSeverity severity
) {}
