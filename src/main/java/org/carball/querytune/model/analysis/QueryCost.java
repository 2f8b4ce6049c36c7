package org.carball.querytune.model.analysis;

/**
 * Heuristic cost breakdown for one statement. All components are in abstract cost units.
 */
public record QueryCost(
        double baseCost,
        double rowScanCost,
        double joinCost,
        double sortCost,
        double totalCost,
        CostCategory category
) {}
