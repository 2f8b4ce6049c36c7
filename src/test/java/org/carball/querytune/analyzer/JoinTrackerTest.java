package org.carball.querytune.analyzer;

import org.carball.querytune.model.stats.JoinPattern;
import org.carball.querytune.model.stats.JoinSummary;
import org.carball.querytune.model.stats.JoinType;
import org.carball.querytune.model.stats.TablePair;
import org.carball.querytune.parser.QueryShapeExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class JoinTrackerTest {

    private final QueryShapeExtractor extractor = new QueryShapeExtractor();
    private JoinTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new JoinTracker();
    }

    private void record(String query, long timeMs) {
        tracker.record(extractor.extract(query), timeMs);
    }

    @Test
    void shouldKeySymmetricallyRegardlessOfJoinDirection() {
        // When
        record("SELECT * FROM users u JOIN orders o ON u.id = o.user_id", 100);
        record("SELECT * FROM orders o JOIN users u ON o.user_id = u.id", 300);

        // Then
        assertThat(tracker.size()).isEqualTo(1);
        JoinPattern pattern = tracker.getPattern("users", "orders").orElseThrow();
        assertThat(pattern.getTables()).isEqualTo(TablePair.of("orders", "users"));
        assertThat(pattern.getJoinCount()).isEqualTo(2);
        assertThat(pattern.getAvgExecutionTimeMs()).isEqualTo(200.0);
        assertThat(tracker.getPattern("orders", "users")).isPresent();
    }

    @Test
    void shouldDetectLeftAndRightJoins() {
        // When
        record("SELECT * FROM users u LEFT JOIN orders o ON o.user_id = u.id", 10);
        record("SELECT * FROM items i RIGHT JOIN stock s ON s.item_id = i.id", 10);
        record("SELECT * FROM a JOIN b ON a.id = b.a_id", 10);

        // Then
        assertThat(tracker.getPattern("users", "orders").orElseThrow().getJoinType()).isEqualTo(JoinType.LEFT);
        assertThat(tracker.getPattern("items", "stock").orElseThrow().getJoinType()).isEqualTo(JoinType.RIGHT);
        assertThat(tracker.getPattern("a", "b").orElseThrow().getJoinType()).isEqualTo(JoinType.INNER);
    }

    @Test
    void shouldFallBackToFirstFromTableWhenConditionNamesNoOtherTable() {
        // When
        record("SELECT * FROM users CROSS JOIN regions", 10);

        // Then
        assertThat(tracker.getPattern("users", "regions")).isPresent();
    }

    @Test
    void shouldScorePerformanceFromFrequencyAndLatency() {
        // Then
        assertThat(JoinTracker.performanceScore(1, 2000.0)).isCloseTo((0.01 + 0.5) / 2, within(1e-9));
        assertThat(JoinTracker.performanceScore(200, 100.0)).isEqualTo(1.0);
        assertThat(JoinTracker.performanceScore(1, 0.0)).isCloseTo((0.01 + 1.0) / 2, within(1e-9));
    }

    @Test
    void shouldIgnoreQueriesWithoutJoins() {
        // When
        record("SELECT * FROM users WHERE id = 1", 10);

        // Then
        assertThat(tracker.size()).isZero();
    }

    @Test
    void shouldRecommendIndexingForFrequentSlowJoins() {
        // Given
        for (int i = 0; i < 5; i++) {
            record("SELECT * FROM users u JOIN orders o ON u.id = o.user_id", 500);
        }
        record("SELECT * FROM a JOIN b ON a.id = b.a_id", 20);

        // Then
        assertThat(tracker.getFrequentJoins(1)).extracting(JoinPattern::getTables)
                .containsExactly(TablePair.of("users", "orders"));
        assertThat(tracker.getSlowJoins(200)).hasSize(1);
        assertThat(tracker.getJoinRecommendations())
                .anyMatch(rec -> rec.startsWith("Found 1 frequent slow joins"));

        JoinSummary summary = tracker.getJoinSummary();
        assertThat(summary.totalJoinPatterns()).isEqualTo(2);
        assertThat(summary.slowJoinPatterns()).isEqualTo(1);
    }
}
