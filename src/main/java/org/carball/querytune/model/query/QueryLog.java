package org.carball.querytune.model.query;

import java.util.List;

/**
 * One executed statement as captured from the query log.
 *
 * @param query           raw statement text
 * @param executionTimeMs wall-clock execution time in milliseconds
 * @param timestamp       Unix epoch milliseconds
 * @param tablesAccessed  tables touched by the statement, in log order
 * @param rowsScanned     rows examined by the statement
 */
public record QueryLog(
        String query,
        long executionTimeMs,
        long timestamp,
        List<String> tablesAccessed,
        long rowsScanned
) {

    public QueryLog {
        query = query == null ? "" : query;
        tablesAccessed = tablesAccessed == null ? List.of() : List.copyOf(tablesAccessed);
    }

    public QueryType queryType() {
        return QueryType.fromQuery(query);
    }

    public boolean isSlow(long thresholdMs) {
        return executionTimeMs > thresholdMs;
    }

    /**
     * Rows-per-millisecond efficiency on a 0..1000 scale; a statement that scanned nothing is 1.0.
     */
    public double efficiencyScore() {
        if (rowsScanned == 0) {
            return 1.0;
        }
        double timePerRow = (double) executionTimeMs / rowsScanned;
        return 1000.0 / (timePerRow + 1.0);
    }
}
