package org.carball.querytune.model.analysis;

/**
 * Workload-wide figures over the analysed query patterns.
 *
 * @param slowQueryCount statements belonging to patterns whose mean time exceeds the slow threshold
 */
public record PatternSummary(
        double avgExecutionTimeMs,
        int patternCount,
        long slowQueryCount
) {

    public static final PatternSummary EMPTY = new PatternSummary(0.0, 0, 0);
}
