package org.carball.querytune.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.querytune.model.stats.PerformanceTrend;
import org.carball.querytune.model.stats.QueryFingerprint;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Groups statements by a coarse structural label computed straight from the raw text.
 * <p>
 * The label is not the {@link org.carball.querytune.parser.QueryShapeExtractor} fingerprint: it also flags
 * GROUP BY and counts keyword substrings anywhere in the text, so {@code ORDER} contributes to the
 * condition count through its {@code OR}.
 */
@Slf4j
public class FingerprintTracker {

    static final long TREND_MIN_COUNT = 3;
    static final double DEGRADING_AVG_MS = 200.0;
    static final double IMPROVING_AVG_MS = 50.0;
    static final long HIGH_FREQUENCY_COUNT = 10;
    static final long OPTIMIZATION_MIN_COUNT = 5;
    static final double OPTIMIZATION_MIN_AVG_MS = 100.0;

    private final Map<String, QueryFingerprint> fingerprints = new HashMap<>();

    public void record(String query, long executionTimeMs) {
        String fingerprint = fingerprintOf(query);

        QueryFingerprint entry = fingerprints.computeIfAbsent(fingerprint,
                key -> QueryFingerprint.builder().fingerprint(key).build());

        entry.setQueryCount(entry.getQueryCount() + 1);
        entry.setAvgExecutionTimeMs(
                RunningAverage.fold(entry.getAvgExecutionTimeMs(), entry.getQueryCount(), executionTimeMs));
        entry.addSample(query);
        entry.setTrend(trendFor(entry.getQueryCount(), entry.getAvgExecutionTimeMs()));
    }

    public static String fingerprintOf(String query) {
        String upper = query == null ? "" : query.toUpperCase(Locale.ROOT);
        StringBuilder fingerprint = new StringBuilder();

        if (upper.contains("SELECT")) {
            fingerprint.append("SELECT_");
        }
        if (upper.contains("FROM")) {
            fingerprint.append("FROM_");
        }
        if (upper.contains("WHERE")) {
            fingerprint.append("WHERE_");
        }
        if (upper.contains("JOIN")) {
            fingerprint.append("JOIN_");
        }
        if (upper.contains("ORDER BY")) {
            fingerprint.append("ORDER_");
        }
        if (upper.contains("GROUP BY")) {
            fingerprint.append("GROUP_");
        }

        int tableCount = countOccurrences(upper, "FROM") + countOccurrences(upper, "JOIN");
        fingerprint.append("TABLES_").append(tableCount);

        int conditionCount = countOccurrences(upper, "AND") + countOccurrences(upper, "OR");
        fingerprint.append("_CONDITIONS_").append(conditionCount);

        return fingerprint.toString();
    }

    private static int countOccurrences(String text, String token) {
        int count = 0;
        int from = text.indexOf(token);
        while (from >= 0) {
            count++;
            from = text.indexOf(token, from + token.length());
        }
        return count;
    }

    /**
     * Stable until {@value #TREND_MIN_COUNT} observations, then decided by the running average alone.
     */
    static PerformanceTrend trendFor(long count, double avgExecutionTimeMs) {
        if (count < TREND_MIN_COUNT) {
            return PerformanceTrend.STABLE;
        }
        if (avgExecutionTimeMs > DEGRADING_AVG_MS) {
            return PerformanceTrend.DEGRADING;
        }
        if (avgExecutionTimeMs < IMPROVING_AVG_MS) {
            return PerformanceTrend.IMPROVING;
        }
        return PerformanceTrend.STABLE;
    }

    public Optional<QueryFingerprint> getFingerprint(String fingerprint) {
        return Optional.ofNullable(fingerprints.get(fingerprint)).map(QueryFingerprint::snapshot);
    }

    public List<QueryFingerprint> getSimilarGroups(long minCount) {
        return fingerprints.values().stream()
                .filter(fp -> fp.getQueryCount() >= minCount)
                .sorted(Comparator.comparingLong(QueryFingerprint::getQueryCount).reversed()
                        .thenComparing(QueryFingerprint::getFingerprint))
                .map(QueryFingerprint::snapshot)
                .collect(Collectors.toList());
    }

    public List<String> getPerformanceInsights() {
        List<String> insights = new ArrayList<>();

        long highFrequency = fingerprints.values().stream()
                .filter(fp -> fp.getQueryCount() >= HIGH_FREQUENCY_COUNT)
                .count();
        insights.add(String.format("Total unique query patterns: %d, High frequency patterns: %d",
                fingerprints.size(), highFrequency));

        long degrading = countWithTrend(PerformanceTrend.DEGRADING);
        if (degrading > 0) {
            insights.add(String.format("Warning: %d query patterns showing performance degradation", degrading));
        }

        long improving = countWithTrend(PerformanceTrend.IMPROVING);
        if (improving > 0) {
            insights.add(String.format("Good news: %d query patterns showing performance improvement", improving));
        }

        return insights;
    }

    private long countWithTrend(PerformanceTrend trend) {
        return fingerprints.values().stream()
                .filter(fp -> fp.getTrend() == trend)
                .count();
    }

    public List<QueryFingerprint> getOptimizationCandidates() {
        return fingerprints.values().stream()
                .filter(fp -> fp.getQueryCount() >= OPTIMIZATION_MIN_COUNT)
                .filter(fp -> fp.getAvgExecutionTimeMs() > OPTIMIZATION_MIN_AVG_MS)
                .sorted(Comparator.comparingDouble(QueryFingerprint::getAvgExecutionTimeMs).reversed())
                .map(QueryFingerprint::snapshot)
                .collect(Collectors.toList());
    }

    public int size() {
        return fingerprints.size();
    }

    public void clear() {
        log.debug("Clearing {} fingerprints", fingerprints.size());
        fingerprints.clear();
    }
}
