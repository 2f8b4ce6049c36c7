package org.carball.querytune.model.analysis;

public record WriteImpact(
        double newWriteTimeMs,
        double impactPercent,
        String impactLevel
) {}
