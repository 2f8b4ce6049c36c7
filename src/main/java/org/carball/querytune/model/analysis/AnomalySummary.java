package org.carball.querytune.model.analysis;

public record AnomalySummary(
        long anomalyCount,
        double anomalyRate,
        double avgExecutionTimeMs
) {

    public static final AnomalySummary EMPTY = new AnomalySummary(0, 0.0, 0.0);
}
