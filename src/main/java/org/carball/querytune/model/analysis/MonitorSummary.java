package org.carball.querytune.model.analysis;

/**
 * @param healthScore    mean, over all metrics, of the percentage of samples graded normal
 * @param activeAlerts   metrics whose latest sample exceeds their threshold
 * @param criticalAlerts active alerts graded critical
 */
public record MonitorSummary(
        double healthScore,
        int activeAlerts,
        int criticalAlerts
) {

    public static final MonitorSummary EMPTY = new MonitorSummary(0.0, 0, 0);
}
