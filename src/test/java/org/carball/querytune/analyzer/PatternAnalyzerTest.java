package org.carball.querytune.analyzer;

import org.carball.querytune.model.analysis.PatternSummary;
import org.carball.querytune.model.query.QueryLog;
import org.carball.querytune.model.query.QueryPattern;
import org.carball.querytune.model.query.QueryType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class PatternAnalyzerTest {

    private PatternAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new PatternAnalyzer();
        analyzer.addLogs(List.of(
                new QueryLog("SELECT * FROM users WHERE id = 1", 150, 0, List.of("users"), 1000),
                new QueryLog("SELECT * FROM users WHERE email = 'a'", 250, 0, List.of("users"), 2000),
                new QueryLog("SELECT * FROM orders", 90, 0, List.of("orders", "users"), 500),
                new QueryLog("INSERT INTO users VALUES (1)", 50, 0, List.of("users"), 0)));
    }

    @Test
    void shouldGroupLogsByQueryType() {
        // When
        List<QueryPattern> patterns = analyzer.analyze();

        // Then
        assertThat(patterns).hasSize(2);
        QueryPattern select = patterns.stream()
                .filter(p -> p.getQueryType() == QueryType.SELECT)
                .findFirst().orElseThrow();
        assertThat(select.getFrequency()).isEqualTo(3);
        assertThat(select.getAvgExecutionTimeMs()).isEqualTo(490.0 / 3);
        assertThat(select.getSlownessScore()).isCloseTo(490.0, within(1e-9));
        assertThat(select.getTables()).containsExactly("orders", "users");
        assertThat(select.getTotalRowsScanned()).isEqualTo(3500);
    }

    @Test
    void shouldRankSlowPatternsBySlownessScore() {
        // When
        List<QueryPattern> slow = analyzer.getSlowPatterns(1);

        // Then
        assertThat(slow).extracting(QueryPattern::getQueryType).containsExactly(QueryType.SELECT);
    }

    @Test
    void shouldFilterFrequentPatterns() {
        // Then
        assertThat(analyzer.getFrequentPatterns(2)).extracting(QueryPattern::getQueryType)
                .containsExactly(QueryType.SELECT);
        assertThat(analyzer.getFrequentPatterns(1)).hasSize(2);
    }

    @Test
    void shouldSummarizePerformance() {
        // When
        PatternSummary summary = analyzer.getPerformanceSummary();

        // Then
        assertThat(summary.avgExecutionTimeMs()).isCloseTo(135.0, within(1e-9));
        assertThat(summary.patternCount()).isEqualTo(2);
        assertThat(summary.slowQueryCount()).isEqualTo(3);
        assertThat(analyzer.totalQueries()).isEqualTo(4);
    }

    @Test
    void shouldReturnEmptyResultsAfterClear() {
        // When
        analyzer.clear();

        // Then
        assertThat(analyzer.analyze()).isEmpty();
        assertThat(analyzer.getPerformanceSummary()).isEqualTo(PatternSummary.EMPTY);
    }
}
