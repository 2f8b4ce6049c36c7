package org.carball.querytune.model.analysis;

public record CostSummary(
        double totalCost,
        double averageCost,
        long highCostCount,
        long lowCostCount
) {

    public static final CostSummary EMPTY = new CostSummary(0.0, 0.0, 0, 0);
}
