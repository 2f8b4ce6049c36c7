package org.carball.querytune.recommender;

import org.carball.querytune.model.query.QueryLog;
import org.carball.querytune.model.query.QueryType;
import org.carball.querytune.model.recommendation.PerformancePrediction;

import java.util.ArrayList;
import java.util.List;

/**
 * Estimates execution time for a query type from the mean of past executions of that type.
 */
public class PerformancePredictor {

    private static final long BASELINE_TIME_MS = 10;
    private static final long BASELINE_ROWS_PER_MS = 100;
    private static final double BASELINE_CONFIDENCE = 0.3;
    private static final double MAX_CONFIDENCE = 0.95;
    private static final double ROWS_PER_FACTOR = 1000.0;
    private static final double CACHE_FACTOR = 0.6;
    private static final long SLOW_ESTIMATE_MS = 100;

    private final List<QueryLog> historicalData = new ArrayList<>();
    private boolean cacheEnabled;

    public PerformancePredictor(boolean cacheEnabled) {
        this.cacheEnabled = cacheEnabled;
    }

    public void addHistoricalData(QueryLog queryLog) {
        historicalData.add(queryLog);
    }

    public PerformancePrediction predict(QueryType queryType, long rowsToScan) {
        List<QueryLog> similar = historicalData.stream()
                .filter(queryLog -> queryLog.queryType() == queryType)
                .toList();

        if (similar.isEmpty()) {
            return new PerformancePrediction(BASELINE_TIME_MS + rowsToScan / BASELINE_ROWS_PER_MS,
                    BASELINE_CONFIDENCE, "No historical data available");
        }

        long avgTime = similar.stream().mapToLong(QueryLog::executionTimeMs).sum() / similar.size();
        double rowFactor = Math.max(rowsToScan / ROWS_PER_FACTOR, 1.0);
        long estimatedTime = (long) (avgTime * rowFactor);
        double cacheFactor = cacheEnabled ? CACHE_FACTOR : 1.0;
        long finalEstimate = (long) (estimatedTime * cacheFactor);

        double confidence = Math.min(similar.size() / 10.0, MAX_CONFIDENCE);
        String recommendation = finalEstimate > SLOW_ESTIMATE_MS
                ? "Consider adding index or optimizing query"
                : "Query performance looks good";

        return new PerformancePrediction(finalEstimate, confidence, recommendation);
    }

    public int historySize() {
        return historicalData.size();
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public void enableCache() {
        cacheEnabled = true;
    }

    public void disableCache() {
        cacheEnabled = false;
    }

    public void clear() {
        historicalData.clear();
    }
}
