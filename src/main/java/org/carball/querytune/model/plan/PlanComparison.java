package org.carball.querytune.model.plan;

public record PlanComparison(
        double costImprovementPercent,
        double timeImprovementPercent,
        String recommendation
) {}
