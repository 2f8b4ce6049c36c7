package org.carball.querytune.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.querytune.model.plan.PlanComparison;
import org.carball.querytune.model.plan.PlanOperation;
import org.carball.querytune.model.plan.QueryPlan;

import java.util.*;

/**
 * Reads execution plans as operation lists and suggests where they can be improved.
 */
@Slf4j
public class QueryPlanAnalyzer {

    public static final double DEFAULT_COST_THRESHOLD = 1000.0;

    private final double costThreshold;

    public QueryPlanAnalyzer() {
        this(DEFAULT_COST_THRESHOLD);
    }

    public QueryPlanAnalyzer(double costThreshold) {
        this.costThreshold = costThreshold;
    }

    /**
     * One suggestion per expensive operation, then one each for sequential scans, nested loops and a
     * plan cost above the threshold.
     */
    public List<String> analyzePlan(QueryPlan plan) {
        List<String> suggestions = new ArrayList<>();

        for (PlanOperation operation : plan.operations()) {
            if (operation.expensive()) {
                suggestions.add(suggestOptimization(operation));
            }
        }

        long seqScans = plan.operations().stream().filter(op -> op.isType(PlanOperation.SEQ_SCAN)).count();
        if (seqScans > 0) {
            suggestions.add(String.format("Found %d sequential scans - consider adding indexes", seqScans));
        }

        if (plan.operations().stream().anyMatch(op -> op.isType(PlanOperation.NESTED_LOOP))) {
            suggestions.add("Nested loops detected - consider hash joins or indexes");
        }

        if (plan.costEstimate() > costThreshold) {
            suggestions.add("High plan cost - consider query rewriting");
        }

        log.debug("Plan {}: {} suggestions", plan.planId(), suggestions.size());
        return suggestions;
    }

    private String suggestOptimization(PlanOperation operation) {
        switch (operation.operationType()) {
            case PlanOperation.SEQ_SCAN:
                return String.format("Sequential scan on %s - add index on frequently queried columns",
                        operation.tableName());
            case PlanOperation.SORT:
                return "Sort operation detected - consider pre-sorted indexes";
            case PlanOperation.HASH_JOIN:
                return "Hash join detected - verify join conditions are indexed";
            case PlanOperation.NESTED_LOOP:
                return String.format("Nested loop on %s - consider hash join or index optimization",
                        operation.tableName());
            default:
                return String.format("Optimize %s operation", operation.operationType());
        }
    }

    /**
     * Improvement of {@code candidate} over {@code current}; a zero baseline counts as no improvement.
     */
    public PlanComparison comparePlans(QueryPlan current, QueryPlan candidate) {
        double costImprovement = current.costEstimate() == 0.0
                ? 0.0
                : (current.costEstimate() - candidate.costEstimate()) / current.costEstimate() * 100.0;
        double timeImprovement = current.executionTimeMs() == 0
                ? 0.0
                : (double) (current.executionTimeMs() - candidate.executionTimeMs()) / current.executionTimeMs() * 100.0;

        String recommendation;
        if (costImprovement > 50.0 && timeImprovement > 30.0) {
            recommendation = "Excellent improvement - implement this plan";
        } else if (costImprovement > 20.0 || timeImprovement > 15.0) {
            recommendation = "Good improvement - consider implementing";
        } else if (costImprovement > 0.0 || timeImprovement > 0.0) {
            recommendation = "Minor improvement - evaluate carefully";
        } else {
            recommendation = "No improvement or regression - keep current plan";
        }

        return new PlanComparison(costImprovement, timeImprovement, recommendation);
    }

    /**
     * Operation types flagged expensive more often than in half of the plans, most frequent first.
     */
    public List<String> identifyPlanPatterns(List<QueryPlan> plans) {
        if (plans.isEmpty()) {
            return List.of();
        }

        Map<String, Integer> expensiveCounts = new TreeMap<>();
        for (QueryPlan plan : plans) {
            for (PlanOperation operation : plan.operations()) {
                if (operation.expensive()) {
                    expensiveCounts.merge(operation.operationType(), 1, Integer::sum);
                }
            }
        }

        List<String> patterns = new ArrayList<>();
        expensiveCounts.entrySet().stream()
                .filter(entry -> entry.getValue() > plans.size() / 2)
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .forEach(entry -> patterns.add(String.format("%s is frequently expensive across %d%% of queries",
                        entry.getKey(), entry.getValue() * 100 / plans.size())));
        return patterns;
    }
}
