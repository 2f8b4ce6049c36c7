package org.carball.querytune.analyzer;

import org.carball.querytune.model.stats.TimePattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class TimeTrackerTest {

    // 2024-01-01T00:00:00Z, a Monday
    private static final long MONDAY_MIDNIGHT_MS = 1_704_067_200_000L;
    private static final long HOUR_MS = 3_600_000L;

    private TimeTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new TimeTracker();
    }

    @Test
    void shouldDeriveHourAndDayOfWeekInUtc() {
        // Then
        assertThat(TimeTracker.hourOfDay(MONDAY_MIDNIGHT_MS + 14 * HOUR_MS + 59_000)).isEqualTo(14);
        assertThat(TimeTracker.dayOfWeek(MONDAY_MIDNIGHT_MS)).isEqualTo(1);
        assertThat(TimeTracker.dayOfWeek(0)).isEqualTo(4);
        assertThat(TimeTracker.dayOfWeek(MONDAY_MIDNIGHT_MS - 1)).isZero();
    }

    @Test
    void shouldSortHourlyPatternsByCountThenHour() {
        // Given
        tracker.record(MONDAY_MIDNIGHT_MS + 9 * HOUR_MS, 10);
        tracker.record(MONDAY_MIDNIGHT_MS + 3 * HOUR_MS, 10);
        tracker.record(MONDAY_MIDNIGHT_MS + 5 * HOUR_MS, 10);
        tracker.record(MONDAY_MIDNIGHT_MS + 5 * HOUR_MS, 30);

        // When
        List<TimePattern> hourly = tracker.getHourlyPatterns();

        // Then
        assertThat(hourly).extracting(TimePattern::hour).containsExactly(5, 3, 9);
        assertThat(hourly.get(0).queryCount()).isEqualTo(2);
        assertThat(hourly.get(0).avgExecutionTimeMs()).isEqualTo(20.0);
    }

    @Test
    void shouldFlagPeakHourOnlyWhenBusyAndSlow() {
        // Given
        for (int i = 0; i < 11; i++) {
            tracker.record(MONDAY_MIDNIGHT_MS + 10 * HOUR_MS, 150);
            tracker.record(MONDAY_MIDNIGHT_MS + 11 * HOUR_MS, 50);
        }

        // Then
        assertThat(tracker.getPeakHours()).extracting(TimePattern::hour).containsExactly(10);
    }

    @Test
    void shouldFlagPeakDayAboveFiftyQueries() {
        // Given
        for (int i = 0; i < 51; i++) {
            tracker.record(MONDAY_MIDNIGHT_MS + i * 1000L, 5);
        }

        // When
        List<TimePattern> daily = tracker.getDailyPatterns();

        // Then
        assertThat(daily).hasSize(1);
        assertThat(daily.get(0).dayOfWeek()).isEqualTo(1);
        assertThat(daily.get(0).peak()).isTrue();
    }

    @Test
    void shouldRecommendBusiestHourAndSlowPeriods() {
        // Given
        tracker.record(MONDAY_MIDNIGHT_MS + 8 * HOUR_MS, 600);
        tracker.record(MONDAY_MIDNIGHT_MS + 8 * HOUR_MS, 600);
        tracker.record(MONDAY_MIDNIGHT_MS + 20 * HOUR_MS, 100);

        // When
        List<String> recommendations = tracker.getTimeRecommendations();

        // Then
        assertThat(recommendations).containsExactly(
                "Peak query activity detected at hour 8 - consider load balancing",
                "Slow query periods detected at hours: [8] - review indexing strategy");
    }

    @Test
    void shouldReturnNoRecommendationsWhenEmpty() {
        // Then
        assertThat(tracker.getTimeRecommendations()).isEmpty();
        assertThat(tracker.getHourlyPatterns()).isEmpty();
    }
}
