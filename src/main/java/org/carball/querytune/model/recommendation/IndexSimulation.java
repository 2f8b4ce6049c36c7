package org.carball.querytune.model.recommendation;

import java.util.List;

public record IndexSimulation(
        String tableName,
        List<String> columnNames,
        long currentExecutionTimeMs,
        long predictedExecutionTimeMs,
        double improvementPercent,
        double confidenceScore,
        double storageCostMb
) {

    public IndexSimulation {
        columnNames = columnNames == null ? List.of() : List.copyOf(columnNames);
    }
}
