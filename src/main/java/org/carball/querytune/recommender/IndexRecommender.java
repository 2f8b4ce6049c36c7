package org.carball.querytune.recommender;

import lombok.extern.slf4j.Slf4j;
import org.carball.querytune.analyzer.ColumnTracker;
import org.carball.querytune.model.query.QueryPattern;
import org.carball.querytune.model.query.QueryType;
import org.carball.querytune.model.recommendation.IndexRecommendation;
import org.carball.querytune.model.recommendation.IndexType;
import org.carball.querytune.model.stats.ColumnUsage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns slow or frequent query patterns into one index suggestion per touched table.
 */
@Slf4j
public class IndexRecommender {

    static final String DEFAULT_COLUMN = "id";

    private static final double BASE_IMPROVEMENT = 40.0;
    private static final double MAX_FREQUENCY_BONUS = 30.0;
    private static final double MAX_SLOWNESS_BONUS = 20.0;
    private static final double HIGH_SLOWNESS_SCORE = 10000.0;
    private static final int HIGH_SLOWNESS_PRIORITY = 100;
    private static final int BASE_PRIORITY = 50;
    private static final long MAX_FREQUENCY_PRIORITY = 50;
    private static final long HASH_INDEX_MIN_FREQUENCY = 100;

    private final double slownessThreshold;
    private final long frequencyThreshold;
    private final ColumnTracker columnTracker;

    public IndexRecommender(double slownessThreshold, long frequencyThreshold) {
        this(slownessThreshold, frequencyThreshold, null);
    }

    /**
     * @param columnTracker when present, each table's most used column is suggested instead of {@value #DEFAULT_COLUMN}
     */
    public IndexRecommender(double slownessThreshold, long frequencyThreshold, ColumnTracker columnTracker) {
        this.slownessThreshold = slownessThreshold;
        this.frequencyThreshold = frequencyThreshold;
        this.columnTracker = columnTracker;
    }

    /**
     * Recommendations sorted by priority, highest first. Equal priorities keep pattern order.
     */
    public List<IndexRecommendation> recommend(List<QueryPattern> patterns) {
        List<IndexRecommendation> recommendations = new ArrayList<>();

        for (QueryPattern pattern : patterns) {
            if (pattern.getSlownessScore() <= slownessThreshold && pattern.getFrequency() <= frequencyThreshold) {
                continue;
            }

            for (String table : pattern.getTables()) {
                recommendations.add(IndexRecommendation.builder()
                        .table(table)
                        .column(columnFor(table))
                        .indexType(indexTypeFor(pattern))
                        .priority(priorityFor(pattern))
                        .estimatedImprovementPercent(improvementFor(pattern))
                        .reason(String.format("Query type: %s, Frequency: %d, Avg time: %.2fms",
                                pattern.getQueryType(), pattern.getFrequency(), pattern.getAvgExecutionTimeMs()))
                        .build());
            }
        }

        recommendations.sort(Comparator.comparingInt(IndexRecommendation::getPriority).reversed());
        log.debug("Generated {} index recommendations from {} patterns", recommendations.size(), patterns.size());
        return recommendations;
    }

    private String columnFor(String table) {
        if (columnTracker == null) {
            return DEFAULT_COLUMN;
        }
        return columnTracker.getColumnsForTable(table).stream()
                .findFirst()
                .map(ColumnUsage::getColumnName)
                .orElse(DEFAULT_COLUMN);
    }

    static double improvementFor(QueryPattern pattern) {
        double frequencyBonus = Math.min(pattern.getFrequency() / 100.0, MAX_FREQUENCY_BONUS);
        double slownessBonus = Math.min(pattern.getSlownessScore() / HIGH_SLOWNESS_SCORE, MAX_SLOWNESS_BONUS);
        return BASE_IMPROVEMENT + frequencyBonus + slownessBonus;
    }

    static int priorityFor(QueryPattern pattern) {
        int base = pattern.getSlownessScore() > HIGH_SLOWNESS_SCORE ? HIGH_SLOWNESS_PRIORITY : BASE_PRIORITY;
        return base + (int) Math.min(pattern.getFrequency() / 10, MAX_FREQUENCY_PRIORITY);
    }

    static IndexType indexTypeFor(QueryPattern pattern) {
        if (pattern.getQueryType() == QueryType.SELECT && pattern.getFrequency() > HASH_INDEX_MIN_FREQUENCY) {
            return IndexType.HASH;
        }
        return IndexType.BTREE;
    }
}
