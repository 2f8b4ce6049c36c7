package org.carball.querytune.analyzer;

import org.carball.querytune.model.plan.PlanComparison;
import org.carball.querytune.model.plan.PlanOperation;
import org.carball.querytune.model.plan.QueryPlan;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class QueryPlanAnalyzerTest {

    private final QueryPlanAnalyzer analyzer = new QueryPlanAnalyzer();

    private static PlanOperation operation(String type, String table, boolean expensive) {
        return new PlanOperation(type, table, 100.0, 1000, 64, expensive);
    }

    private static QueryPlan plan(String id, long timeMs, double cost, PlanOperation... operations) {
        return new QueryPlan(id, "SELECT * FROM orders", timeMs, cost, List.of(operations));
    }

    @Test
    void shouldSuggestFixesForExpensiveOperationsAndScans() {
        // Given
        QueryPlan plan = plan("p1", 300, 2500.0,
                operation(PlanOperation.SEQ_SCAN, "orders", true),
                operation(PlanOperation.SEQ_SCAN, "users", false),
                operation(PlanOperation.NESTED_LOOP, "orders", true),
                operation(PlanOperation.SORT, "", true),
                operation("Materialize", "", true));

        // When
        List<String> suggestions = analyzer.analyzePlan(plan);

        // Then
        assertThat(suggestions).containsExactly(
                "Sequential scan on orders - add index on frequently queried columns",
                "Nested loop on orders - consider hash join or index optimization",
                "Sort operation detected - consider pre-sorted indexes",
                "Optimize Materialize operation",
                "Found 2 sequential scans - consider adding indexes",
                "Nested loops detected - consider hash joins or indexes",
                "High plan cost - consider query rewriting");
    }

    @Test
    void shouldReturnNoSuggestionsForCheapIndexedPlan() {
        // Given
        QueryPlan plan = plan("p2", 5, 12.0,
                operation(PlanOperation.INDEX_SCAN, "users", false),
                operation(PlanOperation.HASH_JOIN, "orders", false));

        // Then
        assertThat(analyzer.analyzePlan(plan)).isEmpty();
    }

    @Test
    void shouldAskToVerifyIndexedJoinConditionsForExpensiveHashJoin() {
        // Given
        QueryPlan plan = plan("p3", 50, 100.0, operation(PlanOperation.HASH_JOIN, "orders", true));

        // Then
        assertThat(analyzer.analyzePlan(plan))
                .containsExactly("Hash join detected - verify join conditions are indexed");
    }

    @Test
    void shouldGradePlanComparison() {
        // Given
        QueryPlan current = plan("old", 200, 1000.0);

        // When
        PlanComparison excellent = analyzer.comparePlans(current, plan("a", 100, 400.0));
        PlanComparison good = analyzer.comparePlans(current, plan("b", 190, 700.0));
        PlanComparison minor = analyzer.comparePlans(current, plan("c", 195, 950.0));
        PlanComparison regression = analyzer.comparePlans(current, plan("d", 250, 1200.0));

        // Then
        assertThat(excellent.costImprovementPercent()).isCloseTo(60.0, within(1e-9));
        assertThat(excellent.timeImprovementPercent()).isCloseTo(50.0, within(1e-9));
        assertThat(excellent.recommendation()).isEqualTo("Excellent improvement - implement this plan");
        assertThat(good.recommendation()).isEqualTo("Good improvement - consider implementing");
        assertThat(minor.recommendation()).isEqualTo("Minor improvement - evaluate carefully");
        assertThat(regression.timeImprovementPercent()).isCloseTo(-25.0, within(1e-9));
        assertThat(regression.recommendation()).isEqualTo("No improvement or regression - keep current plan");
    }

    @Test
    void shouldTreatZeroBaselineAsNoImprovement() {
        // When
        PlanComparison comparison = analyzer.comparePlans(plan("old", 0, 0.0), plan("new", 0, 0.0));

        // Then
        assertThat(comparison.costImprovementPercent()).isZero();
        assertThat(comparison.timeImprovementPercent()).isZero();
        assertThat(comparison.recommendation()).isEqualTo("No improvement or regression - keep current plan");
    }

    @Test
    void shouldReportOperationsExpensiveInMostPlans() {
        // Given
        List<QueryPlan> plans = List.of(
                plan("p1", 100, 10.0, operation(PlanOperation.SEQ_SCAN, "orders", true),
                        operation(PlanOperation.SORT, "", true)),
                plan("p2", 100, 10.0, operation(PlanOperation.SEQ_SCAN, "users", true)),
                plan("p3", 100, 10.0, operation(PlanOperation.SEQ_SCAN, "items", true),
                        operation(PlanOperation.SORT, "", false)),
                plan("p4", 100, 10.0, operation(PlanOperation.INDEX_SCAN, "users", false)));

        // When
        List<String> patterns = analyzer.identifyPlanPatterns(plans);

        // Then
        assertThat(patterns).containsExactly("Seq Scan is frequently expensive across 75% of queries");
        assertThat(analyzer.identifyPlanPatterns(List.of())).isEmpty();
    }
}
