package org.carball.querytune.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.querytune.model.query.QueryShape;
import org.carball.querytune.model.stats.ColumnKey;
import org.carball.querytune.model.stats.ColumnSummary;
import org.carball.querytune.model.stats.ColumnUsage;
import org.carball.querytune.parser.QueryShapeExtractor;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Per-column usage counters fed from WHERE, JOIN and ORDER BY clauses.
 */
@Slf4j
public class ColumnTracker {

    static final int INDEXING_CANDIDATE_MIN_USAGE = 5;

    private static final Comparator<ColumnUsage> BY_USAGE_DESCENDING =
            Comparator.comparingLong(ColumnUsage::getUsageCount).reversed()
                    .thenComparing(usage -> usage.getKey().toString());

    private final Map<ColumnKey, ColumnUsage> columnStats = new HashMap<>();

    private enum ClauseOrigin { WHERE, JOIN, ORDER_BY }

    public void record(QueryShape shape, long executionTimeMs) {
        for (String condition : shape.whereConditions()) {
            columnFromCondition(condition, shape)
                    .ifPresent(key -> updateColumnStats(key, ClauseOrigin.WHERE, executionTimeMs));
        }

        for (String joinClause : shape.joinConditions()) {
            columnFromCondition(QueryShapeExtractor.joinCondition(joinClause), shape)
                    .ifPresent(key -> updateColumnStats(key, ClauseOrigin.JOIN, executionTimeMs));
        }

        for (String item : shape.orderByColumns()) {
            columnFromOrderByItem(item, shape)
                    .ifPresent(key -> updateColumnStats(key, ClauseOrigin.ORDER_BY, executionTimeMs));
        }
    }

    /**
     * A condition names a column only when it compares with {@code =} and its left side is qualified.
     */
    Optional<ColumnKey> columnFromCondition(String condition, QueryShape shape) {
        int equalsPos = condition.indexOf('=');
        if (equalsPos < 0) {
            return Optional.empty();
        }
        String leftSide = condition.substring(0, equalsPos).replaceAll("[<>!]+$", "").trim();
        String[] tokens = leftSide.split("\\s+");
        String operand = tokens[tokens.length - 1].replaceAll("[()]", "");
        int dot = operand.lastIndexOf('.');
        if (dot <= 0 || dot == operand.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(new ColumnKey(shape.resolveTable(operand.substring(0, dot)), operand.substring(dot + 1)));
    }

    private Optional<ColumnKey> columnFromOrderByItem(String item, QueryShape shape) {
        String operand = item.trim().split("\\s+")[0];
        if (operand.isEmpty()) {
            return Optional.empty();
        }
        int dot = operand.lastIndexOf('.');
        if (dot <= 0 || dot == operand.length() - 1) {
            return Optional.of(ColumnKey.unqualified(operand));
        }
        return Optional.of(new ColumnKey(shape.resolveTable(operand.substring(0, dot)), operand.substring(dot + 1)));
    }

    private void updateColumnStats(ColumnKey key, ClauseOrigin origin, long executionTimeMs) {
        ColumnUsage usage = columnStats.computeIfAbsent(key, k -> ColumnUsage.builder().key(k).build());

        usage.setUsageCount(usage.getUsageCount() + 1);
        switch (origin) {
            case WHERE:
                usage.setWhereCount(usage.getWhereCount() + 1);
                break;
            case JOIN:
                usage.setJoinCount(usage.getJoinCount() + 1);
                break;
            case ORDER_BY:
                usage.setOrderByCount(usage.getOrderByCount() + 1);
                break;
        }
        usage.setAvgQueryTimeMs(RunningAverage.fold(usage.getAvgQueryTimeMs(), usage.getUsageCount(), executionTimeMs));
        log.trace("Column {} seen in {} ({} uses)", key, origin, usage.getUsageCount());
    }

    public Optional<ColumnUsage> getUsage(ColumnKey key) {
        return Optional.ofNullable(columnStats.get(key)).map(usage -> usage.toBuilder().build());
    }

    public List<ColumnUsage> getMostUsedColumns(int limit) {
        return columnStats.values().stream()
                .sorted(BY_USAGE_DESCENDING)
                .limit(limit)
                .map(usage -> usage.toBuilder().build())
                .collect(Collectors.toList());
    }

    /**
     * Columns of one table, most used first.
     */
    public List<ColumnUsage> getColumnsForTable(String table) {
        return columnStats.values().stream()
                .filter(usage -> usage.getTableName().equalsIgnoreCase(table))
                .sorted(BY_USAGE_DESCENDING)
                .map(usage -> usage.toBuilder().build())
                .collect(Collectors.toList());
    }

    /**
     * Filter or join columns used at least {@value #INDEXING_CANDIDATE_MIN_USAGE} times.
     */
    public List<ColumnUsage> getIndexingCandidates() {
        return columnStats.values().stream()
                .filter(ColumnUsage::isFilterOrJoinColumn)
                .filter(usage -> usage.getUsageCount() >= INDEXING_CANDIDATE_MIN_USAGE)
                .sorted(BY_USAGE_DESCENDING)
                .map(usage -> usage.toBuilder().build())
                .collect(Collectors.toList());
    }

    public ColumnSummary getPerformanceSummary() {
        int totalColumns = columnStats.size();
        double avgUsage = columnStats.values().stream()
                .mapToLong(ColumnUsage::getUsageCount)
                .average()
                .orElse(0.0);
        return new ColumnSummary(avgUsage, totalColumns, getIndexingCandidates().size());
    }

    public int size() {
        return columnStats.size();
    }

    public void clear() {
        columnStats.clear();
    }
}
