package org.carball.querytune.scoring;

import org.carball.querytune.model.analysis.CostCategory;
import org.carball.querytune.model.analysis.CostComparison;
import org.carball.querytune.model.analysis.CostSummary;
import org.carball.querytune.model.analysis.QueryCost;
import org.carball.querytune.model.query.QueryShape;

import java.util.ArrayList;
import java.util.List;

public class CostCalculator {

    private static final double ROW_COST = 0.001;
    private static final double JOIN_MULTIPLIER = 1.5;
    private static final double SORT_MULTIPLIER = 2.0;

    private static final double HIGH_ROW_SCAN_COST = 50.0;
    private static final double HIGH_JOIN_COST = 100.0;
    private static final double HIGH_SORT_COST = 50.0;
    private static final double VERY_HIGH_TOTAL_COST = 200.0;

    public QueryCost calculateCost(long rowsScanned, long executionTimeMs, int joinCount,
                                   boolean hasOrderBy, boolean hasGroupBy) {
        double baseCost = executionTimeMs;
        double rowScanCost = rowsScanned * ROW_COST;
        double joinCost = joinCount > 0 ? rowScanCost * JOIN_MULTIPLIER * joinCount : 0.0;
        double sortCost = hasOrderBy || hasGroupBy ? rowScanCost * SORT_MULTIPLIER : 0.0;
        double totalCost = baseCost + rowScanCost + joinCost + sortCost;

        return new QueryCost(baseCost, rowScanCost, joinCost, sortCost, totalCost, CostCategory.fromTotal(totalCost));
    }

    public QueryCost calculateFromShape(QueryShape shape, long executionTimeMs, long rowsScanned) {
        return calculateCost(rowsScanned, executionTimeMs, shape.joinConditions().size(),
                shape.hasOrderBy(), shape.hasGroupBy());
    }

    public List<String> getOptimizationSuggestions(QueryCost cost) {
        List<String> suggestions = new ArrayList<>();

        if (cost.rowScanCost() > HIGH_ROW_SCAN_COST) {
            suggestions.add("High row scan cost detected - consider adding indexes on WHERE clause columns");
        }
        if (cost.joinCost() > HIGH_JOIN_COST) {
            suggestions.add("High join cost detected - review join conditions and consider denormalization");
        }
        if (cost.sortCost() > HIGH_SORT_COST) {
            suggestions.add("High sort cost detected - consider pre-sorted indexes or limit result set");
        }
        if (cost.totalCost() > VERY_HIGH_TOTAL_COST) {
            suggestions.add("Very high query cost - consider query rewriting or caching strategy");
        }

        return suggestions;
    }

    public CostComparison compareCosts(QueryCost original, QueryCost optimized) {
        double improvementPercent = original.totalCost() == 0.0
                ? 0.0
                : (original.totalCost() - optimized.totalCost()) / original.totalCost() * 100.0;

        String level;
        if (improvementPercent > 50.0) {
            level = "Excellent";
        } else if (improvementPercent > 20.0) {
            level = "Good";
        } else if (improvementPercent > 0.0) {
            level = "Moderate";
        } else {
            level = "No improvement";
        }

        return new CostComparison(improvementPercent, level);
    }

    public CostSummary getCostSummary(List<QueryCost> costs) {
        if (costs.isEmpty()) {
            return CostSummary.EMPTY;
        }

        double total = costs.stream().mapToDouble(QueryCost::totalCost).sum();
        long high = costs.stream().filter(cost -> cost.category() == CostCategory.HIGH).count();
        long low = costs.stream().filter(cost -> cost.category() == CostCategory.LOW).count();

        return new CostSummary(total, total / costs.size(), high, low);
    }
}
