package org.carball.querytune.model.analysis;

public record PerformanceAlert(
        String alertId,
        String metricName,
        double currentValue,
        double thresholdValue,
        AlertSeverity severity,
        String message,
        long timestamp
) {}
