package org.carball.querytune.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.querytune.model.query.QueryShape;
import org.carball.querytune.model.stats.ColumnKey;
import org.carball.querytune.model.stats.JoinPattern;
import org.carball.querytune.model.stats.JoinSummary;
import org.carball.querytune.model.stats.JoinType;
import org.carball.querytune.model.stats.TablePair;
import org.carball.querytune.parser.QueryShapeExtractor;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Join frequency and latency per unordered table pair.
 */
@Slf4j
public class JoinTracker {

    private static final Pattern QUALIFIED_COLUMN_PATTERN =
            Pattern.compile("([A-Za-z_][\\w]*)\\.[A-Za-z_][\\w]*");

    static final double SLOW_JOIN_RECOMMENDATION_MS = 200.0;
    static final long FREQUENT_JOIN_COUNT = 5;
    static final double HIGH_PERFORMANCE_SCORE = 0.8;
    static final double SLOW_JOIN_SUMMARY_MS = 100.0;

    private final Map<TablePair, JoinPattern> joinStats = new HashMap<>();

    public void record(QueryShape shape, long executionTimeMs) {
        if (!shape.hasJoins()) {
            return;
        }

        for (String joinClause : shape.joinConditions()) {
            Optional<TablePair> pair = extractTablePair(joinClause, shape);
            if (pair.isEmpty()) {
                log.debug("Could not determine joined tables from '{}'", joinClause);
                continue;
            }

            JoinPattern pattern = joinStats.computeIfAbsent(pair.get(), key -> JoinPattern.builder()
                    .tables(key)
                    .joinType(JoinType.detect(joinClause))
                    .build());

            pattern.setJoinCount(pattern.getJoinCount() + 1);
            pattern.setAvgExecutionTimeMs(
                    RunningAverage.fold(pattern.getAvgExecutionTimeMs(), pattern.getJoinCount(), executionTimeMs));
            pattern.setPerformanceScore(performanceScore(pattern.getJoinCount(), pattern.getAvgExecutionTimeMs()));
        }
    }

    /**
     * Pairs the joined table with the table on the other side of the ON condition, falling back to the
     * first FROM table.
     */
    Optional<TablePair> extractTablePair(String joinClause, QueryShape shape) {
        String target = QueryShapeExtractor.joinTarget(joinClause);
        if (target.isEmpty()) {
            return Optional.empty();
        }
        String joinedTable = target.split("\\s+")[0];

        String otherTable = null;
        Matcher matcher = QUALIFIED_COLUMN_PATTERN.matcher(QueryShapeExtractor.joinCondition(joinClause));
        while (matcher.find()) {
            String table = shape.resolveTable(matcher.group(1));
            if (!table.equalsIgnoreCase(joinedTable)) {
                otherTable = table;
                break;
            }
        }
        if (otherTable == null) {
            otherTable = shape.fromTables().isEmpty() ? ColumnKey.UNKNOWN_TABLE : shape.fromTables().get(0);
        }
        return Optional.of(TablePair.of(joinedTable, otherTable));
    }

    /**
     * Mean of a frequency term (count / 100) and a latency term (1000 / avg ms), each capped at 1.0.
     */
    static double performanceScore(long joinCount, double avgExecutionTimeMs) {
        double frequencyScore = Math.min(joinCount / 100.0, 1.0);
        double timeScore = avgExecutionTimeMs <= 0 ? 1.0 : Math.min(1000.0 / avgExecutionTimeMs, 1.0);
        return (frequencyScore + timeScore) / 2.0;
    }

    public Optional<JoinPattern> getPattern(String table1, String table2) {
        return Optional.ofNullable(joinStats.get(TablePair.of(table1, table2)))
                .map(pattern -> pattern.toBuilder().build());
    }

    public List<JoinPattern> getFrequentJoins(int limit) {
        return joinStats.values().stream()
                .sorted(Comparator.comparingLong(JoinPattern::getJoinCount).reversed()
                        .thenComparing(pattern -> pattern.getTables().toString()))
                .limit(limit)
                .map(pattern -> pattern.toBuilder().build())
                .collect(Collectors.toList());
    }

    public List<JoinPattern> getSlowJoins(double thresholdMs) {
        return joinStats.values().stream()
                .filter(pattern -> pattern.getAvgExecutionTimeMs() > thresholdMs)
                .sorted(Comparator.comparingDouble(JoinPattern::getAvgExecutionTimeMs).reversed())
                .map(pattern -> pattern.toBuilder().build())
                .collect(Collectors.toList());
    }

    public List<String> getJoinRecommendations() {
        List<String> recommendations = new ArrayList<>();

        long frequentSlowJoins = getSlowJoins(SLOW_JOIN_RECOMMENDATION_MS).stream()
                .filter(pattern -> pattern.getJoinCount() >= FREQUENT_JOIN_COUNT)
                .count();
        if (frequentSlowJoins > 0) {
            recommendations.add(String.format(
                    "Found %d frequent slow joins - consider adding indexes or optimizing join conditions",
                    frequentSlowJoins));
        }

        long highPerformanceJoins = joinStats.values().stream()
                .filter(pattern -> pattern.getPerformanceScore() > HIGH_PERFORMANCE_SCORE)
                .count();
        if (highPerformanceJoins > 0) {
            recommendations.add(String.format(
                    "Good performance detected in %d join patterns - maintain current optimization",
                    highPerformanceJoins));
        }

        return recommendations;
    }

    public JoinSummary getJoinSummary() {
        double avgPerformance = joinStats.values().stream()
                .mapToDouble(JoinPattern::getPerformanceScore)
                .average()
                .orElse(0.0);
        return new JoinSummary(joinStats.size(), avgPerformance, getSlowJoins(SLOW_JOIN_SUMMARY_MS).size());
    }

    public int size() {
        return joinStats.size();
    }

    public void clear() {
        joinStats.clear();
    }
}
