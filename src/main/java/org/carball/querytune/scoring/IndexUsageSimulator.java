package org.carball.querytune.scoring;

import lombok.extern.slf4j.Slf4j;
import org.carball.querytune.model.recommendation.IndexSimulation;
import org.carball.querytune.model.recommendation.RoiAnalysis;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Estimates what a candidate index would do to a query before it is built: predicted time, storage
 * footprint and how far the estimate can be trusted.
 */
@Slf4j
public class IndexUsageSimulator {

    private static final double BASE_IMPROVEMENT = 0.1;
    private static final double PER_COLUMN_FACTOR = 0.05;
    private static final long LARGE_SCAN_ROWS = 10000;
    private static final long MEDIUM_SCAN_ROWS = 1000;
    private static final double BYTES_PER_COLUMN_VALUE = 8.0;
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    public IndexSimulation simulateIndexImpact(String tableName, List<String> columns,
                                               long currentTimeMs, long rowsScanned) {
        long predictedTimeMs = predictTime(currentTimeMs, rowsScanned, columns.size());
        double improvement = currentTimeMs == 0
                ? 0.0
                : (double) (currentTimeMs - predictedTimeMs) / currentTimeMs * 100.0;

        IndexSimulation simulation = new IndexSimulation(tableName, columns, currentTimeMs, predictedTimeMs,
                improvement, confidence(columns.size(), rowsScanned), storageCostMb(columns.size(), rowsScanned));
        log.debug("Simulated index on {}{}: {} ms -> {} ms", tableName, columns, currentTimeMs, predictedTimeMs);
        return simulation;
    }

    private long predictTime(long currentTimeMs, long rowsScanned, int columnCount) {
        double columnFactor = Math.max(1.0 - columnCount * PER_COLUMN_FACTOR, 0.0);
        double rowFactor;
        if (rowsScanned > LARGE_SCAN_ROWS) {
            rowFactor = 0.05;
        } else if (rowsScanned > MEDIUM_SCAN_ROWS) {
            rowFactor = 0.2;
        } else {
            rowFactor = 0.5;
        }

        double totalImprovement = BASE_IMPROVEMENT * columnFactor * rowFactor;
        long predicted = (long) (currentTimeMs * (1.0 - totalImprovement));
        return Math.max(predicted, 1);
    }

    private double storageCostMb(int columnCount, long rowsScanned) {
        return BYTES_PER_COLUMN_VALUE * columnCount * rowsScanned / BYTES_PER_MB;
    }

    /**
     * Mean of a column-count confidence (single column 0.9, up to three 0.8, more 0.6) and a scan-size
     * confidence (over 10000 rows 0.9, over 1000 rows 0.8, else 0.6).
     */
    private double confidence(int columnCount, long rowsScanned) {
        double columnConfidence;
        if (columnCount == 1) {
            columnConfidence = 0.9;
        } else if (columnCount <= 3) {
            columnConfidence = 0.8;
        } else {
            columnConfidence = 0.6;
        }

        double rowConfidence;
        if (rowsScanned > LARGE_SCAN_ROWS) {
            rowConfidence = 0.9;
        } else if (rowsScanned > MEDIUM_SCAN_ROWS) {
            rowConfidence = 0.8;
        } else {
            rowConfidence = 0.6;
        }

        return (columnConfidence + rowConfidence) / 2.0;
    }

    /**
     * Simulations ordered by improvement, largest first.
     */
    public List<IndexSimulation> simulateMultipleIndexes(List<IndexSimulation> simulations) {
        return simulations.stream()
                .sorted(Comparator.comparingDouble(IndexSimulation::improvementPercent).reversed())
                .collect(Collectors.toList());
    }

    public RoiAnalysis getRoiAnalysis(IndexSimulation simulation) {
        double roiScore = simulation.storageCostMb() > 0.0
                ? simulation.improvementPercent() / simulation.storageCostMb()
                : simulation.improvementPercent();

        String recommendation;
        if (roiScore > 50.0) {
            recommendation = "Excellent ROI - highly recommended";
        } else if (roiScore > 20.0) {
            recommendation = "Good ROI - recommended";
        } else if (roiScore > 10.0) {
            recommendation = "Moderate ROI - consider carefully";
        } else {
            recommendation = "Low ROI - not recommended";
        }

        return new RoiAnalysis(roiScore, recommendation);
    }
}
