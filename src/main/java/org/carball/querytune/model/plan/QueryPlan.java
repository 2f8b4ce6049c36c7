package org.carball.querytune.model.plan;

import java.util.List;

public record QueryPlan(
        String planId,
        String queryText,
        long executionTimeMs,
        double costEstimate,
        List<PlanOperation> operations
) {

    public QueryPlan {
        operations = operations == null ? List.of() : List.copyOf(operations);
    }
}
