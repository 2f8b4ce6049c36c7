package org.carball.querytune.scoring;

import org.carball.querytune.model.analysis.MaintenanceCost;
import org.carball.querytune.model.analysis.WriteImpact;

/**
 * Estimates what an index costs on the write path.
 */
public class IndexMaintenanceCostAnalyzer {

    private static final double BASE_WRITE_TIME_MS = 1.0;
    private static final double INDEX_OVERHEAD_FACTOR = 0.15;
    private static final double PER_COLUMN_OVERHEAD = 0.05;
    private static final double MAX_FREQUENCY_FACTOR = 2.0;

    private static final double UPDATE_COST_MULTIPLIER = 1.5;
    private static final double DELETE_COST_MULTIPLIER = 0.8;
    private static final double BATCH_MS_PER_RECORD = 0.001;

    public MaintenanceCost calculateMaintenanceCost(String indexName, String tableName,
                                                    int columnCount, long writeFrequency) {
        double overhead = INDEX_OVERHEAD_FACTOR * (1.0 + columnCount * PER_COLUMN_OVERHEAD);
        double frequencyFactor = Math.min(writeFrequency / 1000.0, MAX_FREQUENCY_FACTOR);

        double insertCost = BASE_WRITE_TIME_MS * overhead * frequencyFactor;
        double updateCost = BASE_WRITE_TIME_MS * UPDATE_COST_MULTIPLIER * overhead * frequencyFactor;
        double deleteCost = BASE_WRITE_TIME_MS * DELETE_COST_MULTIPLIER * overhead * frequencyFactor;
        double total = insertCost + updateCost + deleteCost;

        return MaintenanceCost.builder()
                .indexName(indexName)
                .tableName(tableName)
                .writeOverheadPercent(overhead * 100.0)
                .insertCostMs(insertCost)
                .updateCostMs(updateCost)
                .deleteCostMs(deleteCost)
                .totalMaintenanceCost(total)
                .recommendation(recommendationFor(total, writeFrequency))
                .build();
    }

    private String recommendationFor(double totalCost, long writeFrequency) {
        if (totalCost > 10.0 && writeFrequency > 1000) {
            return "High maintenance cost - consider removing index";
        } else if (totalCost > 5.0) {
            return "Moderate maintenance cost - monitor performance";
        } else if (totalCost < 2.0) {
            return "Low maintenance cost - index is efficient";
        }
        return "Acceptable maintenance cost";
    }

    public WriteImpact analyzeWriteImpact(double currentWriteTimeMs, int indexCount) {
        double overhead = indexCount * INDEX_OVERHEAD_FACTOR;
        double impactPercent = overhead * 100.0;

        String impactLevel;
        if (impactPercent > 50.0) {
            impactLevel = "High impact - significant write slowdown";
        } else if (impactPercent > 25.0) {
            impactLevel = "Moderate impact - noticeable write slowdown";
        } else if (impactPercent > 10.0) {
            impactLevel = "Low impact - minimal write slowdown";
        } else {
            impactLevel = "Negligible impact - no significant slowdown";
        }

        return new WriteImpact(currentWriteTimeMs * (1.0 + overhead), impactPercent, impactLevel);
    }

    /**
     * Batch write time in milliseconds with {@code indexCount} indexes to maintain.
     */
    public double analyzeBatchOperations(long batchSize, int indexCount) {
        return batchSize * BATCH_MS_PER_RECORD * (1.0 + indexCount * INDEX_OVERHEAD_FACTOR);
    }

    /**
     * Index count suited to the read/write mix. No writes at all counts as the most read-heavy mix.
     */
    public int getOptimalIndexCount(long readFrequency, long writeFrequency) {
        double ratio = writeFrequency == 0 ? Double.POSITIVE_INFINITY : (double) readFrequency / writeFrequency;

        if (ratio > 10.0) {
            return 5;
        } else if (ratio > 5.0) {
            return 3;
        } else if (ratio > 2.0) {
            return 2;
        }
        return 1;
    }
}
