package org.carball.querytune.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.querytune.model.analysis.PatternSummary;
import org.carball.querytune.model.query.QueryLog;
import org.carball.querytune.model.query.QueryPattern;
import org.carball.querytune.model.query.QueryType;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Keeps every ingested log and summarises them per {@link QueryType} on demand.
 */
@Slf4j
public class PatternAnalyzer {

    static final double SLOW_PATTERN_AVG_MS = 100.0;

    private final List<QueryLog> logs = new ArrayList<>();

    public void addLog(QueryLog queryLog) {
        logs.add(queryLog);
    }

    public void addLogs(Collection<QueryLog> queryLogs) {
        logs.addAll(queryLogs);
    }

    /**
     * One pattern per query type present in the log, in {@link QueryType} declaration order.
     */
    public List<QueryPattern> analyze() {
        Map<QueryType, List<QueryLog>> byType = new EnumMap<>(QueryType.class);
        for (QueryLog queryLog : logs) {
            byType.computeIfAbsent(queryLog.queryType(), type -> new ArrayList<>()).add(queryLog);
        }

        List<QueryPattern> patterns = new ArrayList<>();
        for (Map.Entry<QueryType, List<QueryLog>> entry : byType.entrySet()) {
            patterns.add(buildPattern(entry.getKey(), entry.getValue()));
        }

        log.debug("Analyzed {} logs into {} patterns", logs.size(), patterns.size());
        return patterns;
    }

    private QueryPattern buildPattern(QueryType type, List<QueryLog> group) {
        long totalTime = group.stream().mapToLong(QueryLog::executionTimeMs).sum();
        long totalRows = group.stream().mapToLong(QueryLog::rowsScanned).sum();
        double avgTime = (double) totalTime / group.size();

        List<String> tables = group.stream()
                .flatMap(queryLog -> queryLog.tablesAccessed().stream())
                .distinct()
                .sorted()
                .collect(Collectors.toList());

        return QueryPattern.builder()
                .queryType(type)
                .avgExecutionTimeMs(avgTime)
                .frequency(group.size())
                .tables(tables)
                .slownessScore(avgTime * group.size())
                .totalRowsScanned(totalRows)
                .build();
    }

    public List<QueryPattern> getSlowPatterns(int limit) {
        return analyze().stream()
                .sorted(Comparator.comparingDouble(QueryPattern::getSlownessScore).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    public List<QueryPattern> getFrequentPatterns(long minFrequency) {
        return analyze().stream()
                .filter(pattern -> pattern.getFrequency() >= minFrequency)
                .collect(Collectors.toList());
    }

    public PatternSummary getPerformanceSummary() {
        if (logs.isEmpty()) {
            return PatternSummary.EMPTY;
        }

        List<QueryPattern> patterns = analyze();
        double weightedTime = patterns.stream()
                .mapToDouble(pattern -> pattern.getAvgExecutionTimeMs() * pattern.getFrequency())
                .sum();
        long slowQueries = patterns.stream()
                .filter(pattern -> pattern.getAvgExecutionTimeMs() > SLOW_PATTERN_AVG_MS)
                .mapToLong(QueryPattern::getFrequency)
                .sum();

        return new PatternSummary(weightedTime / logs.size(), patterns.size(), slowQueries);
    }

    public int totalQueries() {
        return logs.size();
    }

    public void clear() {
        logs.clear();
    }
}
