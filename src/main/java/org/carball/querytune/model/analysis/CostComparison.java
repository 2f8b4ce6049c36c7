package org.carball.querytune.model.analysis;

public record CostComparison(
        double improvementPercent,
        String improvementLevel
) {}
