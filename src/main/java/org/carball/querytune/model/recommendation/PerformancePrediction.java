package org.carball.querytune.model.recommendation;

public record PerformancePrediction(
        long estimatedTimeMs,
        double confidence,
        String recommendation
) {}
