package org.carball.querytune.analyzer;

import org.carball.querytune.config.AnalyzerThresholds;
import org.carball.querytune.model.analysis.AlertSeverity;
import org.carball.querytune.model.analysis.AnalysisResult;
import org.carball.querytune.model.analysis.AnomalyType;
import org.carball.querytune.model.analysis.CostCategory;
import org.carball.querytune.model.analysis.PerformanceAlert;
import org.carball.querytune.model.analysis.QueryCost;
import org.carball.querytune.model.query.QueryLog;
import org.carball.querytune.model.query.QueryPattern;
import org.carball.querytune.model.query.QueryType;
import org.carball.querytune.model.recommendation.IndexType;
import org.carball.querytune.model.recommendation.PerformancePrediction;
import org.carball.querytune.scoring.PerformanceMonitor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class QueryLogAnalyzerTest {

    private QueryLogAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new QueryLogAnalyzer(AnalyzerThresholds.defaults());
    }

    private static List<QueryLog> sampleWorkload() {
        return List.of(
                new QueryLog("SELECT * FROM users WHERE id = 1", 150, 0, List.of("users"), 1000),
                new QueryLog("SELECT * FROM users WHERE id = 2", 250, 0, List.of("users"), 1000),
                new QueryLog("SELECT * FROM users WHERE id = 3", 90, 0, List.of("users"), 1000),
                new QueryLog("INSERT INTO orders VALUES (1)", 50, 0, List.of("orders"), 0));
    }

    @Test
    void shouldGroupLogsIntoPatternsPerQueryType() {
        // Given
        analyzer.ingestAll(sampleWorkload());

        // When
        AnalysisResult result = analyzer.analyze();

        // Then
        assertThat(result.totalQueries()).isEqualTo(4);
        assertThat(result.queryPatterns()).extracting(QueryPattern::getQueryType)
                .containsExactly(QueryType.SELECT, QueryType.INSERT);

        QueryPattern select = result.queryPatterns().get(0);
        assertThat(select.getFrequency()).isEqualTo(3);
        assertThat(select.getAvgExecutionTimeMs()).isCloseTo(163.33, within(0.01));
        assertThat(select.getSlownessScore()).isCloseTo(490.0, within(1e-9));
        assertThat(select.getTables()).containsExactly("users");

        QueryPattern insert = result.queryPatterns().get(1);
        assertThat(insert.getFrequency()).isEqualTo(1);
        assertThat(insert.getAvgExecutionTimeMs()).isCloseTo(50.0, within(1e-9));
    }

    @Test
    void shouldRecommendBTreeIndexOnUsersTable() {
        // Given
        analyzer.ingestAll(sampleWorkload());

        // When
        AnalysisResult result = analyzer.analyze();

        // Then
        assertThat(result.indexRecommendations()).isNotEmpty();
        assertThat(result.indexRecommendations()).anySatisfy(recommendation -> {
            assertThat(recommendation.getTable()).isEqualTo("users");
            assertThat(recommendation.getIndexType()).isEqualTo(IndexType.BTREE);
        });
        assertThat(result.indexRecommendations())
                .noneSatisfy(recommendation -> assertThat(recommendation.getTable()).isEqualTo("orders"));
    }

    @Test
    void shouldPredictFromHistoryWithCache() {
        // Given
        analyzer.ingest(new QueryLog("SELECT * FROM users WHERE id = 1", 150, 0, List.of("users"), 100));
        analyzer.ingest(new QueryLog("SELECT * FROM users WHERE id = 2", 250, 0, List.of("users"), 100));

        // When
        PerformancePrediction prediction = analyzer.predict(QueryType.SELECT, 2000);

        // Then
        assertThat(prediction.estimatedTimeMs()).isEqualTo(240);
        assertThat(prediction.confidence()).isEqualTo(0.2);
    }

    @Test
    void shouldFillTrackersAndInsights() {
        // Given
        analyzer.ingestAll(sampleWorkload());

        // When
        AnalysisResult result = analyzer.analyze();

        // Then
        assertThat(analyzer.getPatternAnalyzer().totalQueries()).isEqualTo(4);
        assertThat(analyzer.getAnomalyDetector().historySize()).isEqualTo(4);
        assertThat(result.hourlyPatterns()).hasSize(1);
        assertThat(result.hourlyPatterns().get(0).queryCount()).isEqualTo(4);
        assertThat(result.fingerprintInsights())
                .containsExactly("Total unique query patterns: 2, High frequency patterns: 0");
        assertThat(result.patternSummary().patternCount()).isEqualTo(2);
    }

    @Test
    void shouldReportInsufficientDataUntilMinimumSamples() {
        // Given
        analyzer.ingestAll(sampleWorkload());

        // When / Then
        assertThat(analyzer.detectAnomaly(5000).type()).isEqualTo(AnomalyType.INSUFFICIENT_DATA);
    }

    @Test
    void shouldEstimateCostFromStatementShape() {
        // Given
        QueryLog queryLog = new QueryLog(
                "SELECT * FROM orders o JOIN users u ON o.user_id = u.id ORDER BY o.created_at",
                20, 0, List.of("orders", "users"), 10000);

        // When
        QueryCost cost = analyzer.estimateCost(queryLog);

        // Then
        assertThat(cost.rowScanCost()).isCloseTo(10.0, within(1e-9));
        assertThat(cost.joinCost()).isCloseTo(15.0, within(1e-9));
        assertThat(cost.sortCost()).isCloseTo(20.0, within(1e-9));
        assertThat(cost.totalCost()).isCloseTo(65.0, within(1e-9));
        assertThat(cost.category()).isEqualTo(CostCategory.MEDIUM);
    }

    @Test
    void shouldHandleLogWithoutStatementText() {
        // Given
        analyzer.ingest(new QueryLog("", 30, 0, List.of(), 0));

        // When
        AnalysisResult result = analyzer.analyze();

        // Then
        assertThat(result.totalQueries()).isEqualTo(1);
        assertThat(result.queryPatterns()).extracting(QueryPattern::getQueryType).containsExactly(QueryType.OTHER);
        assertThat(result.indexRecommendations()).isEmpty();
    }

    @Test
    void shouldAlertWhenLatestQueryTimeExceedsThreshold() {
        // Given
        analyzer.ingestAll(sampleWorkload());
        analyzer.ingest(new QueryLog("SELECT * FROM orders", 2500, 0, List.of("orders"), 50000));

        // When
        List<PerformanceAlert> alerts = analyzer.checkAlerts();

        // Then
        assertThat(analyzer.getPerformanceMonitor().historySize(PerformanceMonitor.QUERY_TIME)).isEqualTo(5);
        assertThat(alerts).singleElement().satisfies(alert -> {
            assertThat(alert.metricName()).isEqualTo(PerformanceMonitor.QUERY_TIME);
            assertThat(alert.currentValue()).isEqualTo(2500.0);
            assertThat(alert.severity()).isEqualTo(AlertSeverity.CRITICAL);
        });
    }

    @Test
    void shouldNotAlertForFastWorkload() {
        // Given
        analyzer.ingestAll(sampleWorkload());

        // Then
        assertThat(analyzer.checkAlerts()).isEmpty();
    }

    @Test
    void shouldResetEverythingOnClear() {
        // Given
        analyzer.ingestAll(sampleWorkload());

        // When
        analyzer.clear();
        AnalysisResult result = analyzer.analyze();

        // Then
        assertThat(result.totalQueries()).isZero();
        assertThat(result.queryPatterns()).isEmpty();
        assertThat(result.topColumns()).isEmpty();
        assertThat(analyzer.getAnomalyDetector().historySize()).isZero();
        assertThat(analyzer.getPerformanceMonitor().historySize(PerformanceMonitor.QUERY_TIME)).isZero();
        assertThat(analyzer.predict(QueryType.SELECT, 0).confidence()).isEqualTo(0.3);
    }
}
