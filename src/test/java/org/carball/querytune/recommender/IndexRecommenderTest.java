package org.carball.querytune.recommender;

import org.carball.querytune.analyzer.ColumnTracker;
import org.carball.querytune.analyzer.PatternAnalyzer;
import org.carball.querytune.model.query.QueryLog;
import org.carball.querytune.model.query.QueryPattern;
import org.carball.querytune.model.query.QueryType;
import org.carball.querytune.model.recommendation.IndexRecommendation;
import org.carball.querytune.model.recommendation.IndexType;
import org.carball.querytune.parser.QueryShapeExtractor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class IndexRecommenderTest {

    private static QueryPattern pattern(QueryType type, long frequency, double avgMs, String... tables) {
        return QueryPattern.builder()
                .queryType(type)
                .frequency(frequency)
                .avgExecutionTimeMs(avgMs)
                .slownessScore(avgMs * frequency)
                .tables(List.of(tables))
                .build();
    }

    @Test
    void shouldRecommendBTreeIndexForSlowSelectPattern() {
        // Given
        PatternAnalyzer analyzer = new PatternAnalyzer();
        analyzer.addLog(new QueryLog("SELECT * FROM users WHERE id = 1", 150, 0, List.of("users"), 100));
        analyzer.addLog(new QueryLog("SELECT * FROM users WHERE id = 2", 250, 0, List.of("users"), 100));
        analyzer.addLog(new QueryLog("SELECT * FROM users WHERE id = 3", 90, 0, List.of("users"), 100));
        analyzer.addLog(new QueryLog("INSERT INTO orders VALUES (1)", 50, 0, List.of("orders"), 0));
        IndexRecommender recommender = new IndexRecommender(100.0, 1);

        // When
        List<IndexRecommendation> recommendations = recommender.recommend(analyzer.analyze());

        // Then
        assertThat(recommendations).hasSize(1);
        IndexRecommendation recommendation = recommendations.get(0);
        assertThat(recommendation.getTable()).isEqualTo("users");
        assertThat(recommendation.getColumn()).isEqualTo("id");
        assertThat(recommendation.getIndexType()).isEqualTo(IndexType.BTREE);
        assertThat(recommendation.getPriority()).isEqualTo(50);
        assertThat(recommendation.getReason()).startsWith("Query type: SELECT, Frequency: 3, Avg time: 163.33ms");
    }

    @Test
    void shouldComputeImprovementAndPriorityWithCaps() {
        // Given
        QueryPattern hot = pattern(QueryType.SELECT, 5000, 100.0, "events");

        // Then
        assertThat(IndexRecommender.improvementFor(hot)).isCloseTo(40.0 + 30.0 + 20.0, within(1e-9));
        assertThat(IndexRecommender.priorityFor(hot)).isEqualTo(150);
        assertThat(IndexRecommender.indexTypeFor(hot)).isEqualTo(IndexType.HASH);
    }

    @Test
    void shouldUseIntegerDivisionForFrequencyPriorityBonus() {
        // Given
        QueryPattern pattern = pattern(QueryType.UPDATE, 19, 10.0, "t");

        // Then
        assertThat(IndexRecommender.priorityFor(pattern)).isEqualTo(51);
        assertThat(IndexRecommender.indexTypeFor(pattern)).isEqualTo(IndexType.BTREE);
    }

    @Test
    void shouldSortByPriorityDescendingKeepingPatternOrderForTies() {
        // Given
        List<QueryPattern> patterns = List.of(
                pattern(QueryType.UPDATE, 20, 10.0, "a", "b"),
                pattern(QueryType.SELECT, 200, 100.0, "c"));
        IndexRecommender recommender = new IndexRecommender(100.0, 1);

        // When
        List<IndexRecommendation> recommendations = recommender.recommend(patterns);

        // Then
        assertThat(recommendations).extracting(IndexRecommendation::getTable).containsExactly("c", "a", "b");
        assertThat(recommendations).isSortedAccordingTo((x, y) -> Integer.compare(y.getPriority(), x.getPriority()));
    }

    @Test
    void shouldSkipPatternsBelowBothThresholds() {
        // Given
        IndexRecommender recommender = new IndexRecommender(1000.0, 10);

        // When
        List<IndexRecommendation> recommendations = recommender.recommend(
                List.of(pattern(QueryType.SELECT, 10, 100.0, "users")));

        // Then
        assertThat(recommendations).isEmpty();
    }

    @Test
    void shouldSuggestMostUsedColumnWhenTrackerSupplied() {
        // Given
        ColumnTracker tracker = new ColumnTracker();
        QueryShapeExtractor extractor = new QueryShapeExtractor();
        tracker.record(extractor.extract("SELECT * FROM users u WHERE u.email = 'a'"), 10);
        tracker.record(extractor.extract("SELECT * FROM users u WHERE u.email = 'b'"), 10);
        tracker.record(extractor.extract("SELECT * FROM users u WHERE u.status = 'c'"), 10);
        IndexRecommender recommender = new IndexRecommender(0.0, 0, tracker);

        // When
        List<IndexRecommendation> recommendations = recommender.recommend(
                List.of(pattern(QueryType.SELECT, 3, 10.0, "users", "orders")));

        // Then
        assertThat(recommendations).extracting(IndexRecommendation::getColumn).containsExactly("email", "id");
        assertThat(recommendations.get(0).toCreateStatement()).isEqualTo("CREATE INDEX idx_users_email ON users (email)");
    }
}
