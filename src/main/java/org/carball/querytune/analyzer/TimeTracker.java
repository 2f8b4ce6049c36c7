package org.carball.querytune.analyzer;

import org.carball.querytune.model.stats.TimePattern;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Query volume and latency per hour of day and per day of week (UTC).
 */
public class TimeTracker {

    static final long HOURLY_PEAK_MIN_COUNT = 10;
    static final double HOURLY_PEAK_MIN_AVG_MS = 100.0;
    static final long DAILY_PEAK_MIN_COUNT = 50;
    static final double SLOW_HOUR_TOTAL_MS = 1000.0;

    private static final long MILLIS_PER_SECOND = 1000;
    private static final long SECONDS_PER_DAY = 86400;
    private static final long SECONDS_PER_HOUR = 3600;
    // 1970-01-01 was a Thursday
    private static final long EPOCH_DAY_OF_WEEK = 4;

    private final Map<Integer, Bucket> hourlyStats = new HashMap<>();
    private final Map<Integer, Bucket> dailyStats = new HashMap<>();

    public void record(long timestampMs, long executionTimeMs) {
        hourlyStats.computeIfAbsent(hourOfDay(timestampMs), h -> new Bucket()).add(executionTimeMs);
        dailyStats.computeIfAbsent(dayOfWeek(timestampMs), d -> new Bucket()).add(executionTimeMs);
    }

    static int hourOfDay(long timestampMs) {
        long seconds = Math.floorDiv(timestampMs, MILLIS_PER_SECOND);
        return (int) (Math.floorMod(seconds, SECONDS_PER_DAY) / SECONDS_PER_HOUR);
    }

    /**
     * Day of week with Sunday = 0.
     */
    static int dayOfWeek(long timestampMs) {
        long daysSinceEpoch = Math.floorDiv(Math.floorDiv(timestampMs, MILLIS_PER_SECOND), SECONDS_PER_DAY);
        return (int) Math.floorMod(daysSinceEpoch + EPOCH_DAY_OF_WEEK, 7);
    }

    public List<TimePattern> getHourlyPatterns() {
        return hourlyStats.entrySet().stream()
                .map(entry -> {
                    Bucket bucket = entry.getValue();
                    boolean peak = bucket.count > HOURLY_PEAK_MIN_COUNT && bucket.average > HOURLY_PEAK_MIN_AVG_MS;
                    return new TimePattern(entry.getKey(), 0, bucket.count, bucket.average, peak);
                })
                .sorted(Comparator.comparingLong(TimePattern::queryCount).reversed()
                        .thenComparingInt(TimePattern::hour))
                .collect(Collectors.toList());
    }

    public List<TimePattern> getDailyPatterns() {
        return dailyStats.entrySet().stream()
                .map(entry -> {
                    Bucket bucket = entry.getValue();
                    return new TimePattern(0, entry.getKey(), bucket.count, bucket.average,
                            bucket.count > DAILY_PEAK_MIN_COUNT);
                })
                .sorted(Comparator.comparingLong(TimePattern::queryCount).reversed()
                        .thenComparingInt(TimePattern::dayOfWeek))
                .collect(Collectors.toList());
    }

    public List<TimePattern> getPeakHours() {
        return getHourlyPatterns().stream()
                .filter(TimePattern::peak)
                .collect(Collectors.toList());
    }

    public List<String> getTimeRecommendations() {
        List<String> recommendations = new ArrayList<>();

        List<TimePattern> hourly = getHourlyPatterns();
        if (!hourly.isEmpty()) {
            recommendations.add(String.format(
                    "Peak query activity detected at hour %d - consider load balancing", hourly.get(0).hour()));
        }

        List<Integer> slowHours = hourlyStats.entrySet().stream()
                .filter(entry -> entry.getValue().total() > SLOW_HOUR_TOTAL_MS)
                .map(Map.Entry::getKey)
                .sorted()
                .collect(Collectors.toList());
        if (!slowHours.isEmpty()) {
            recommendations.add(String.format(
                    "Slow query periods detected at hours: %s - review indexing strategy", slowHours));
        }

        return recommendations;
    }

    public void clear() {
        hourlyStats.clear();
        dailyStats.clear();
    }

    private static final class Bucket {
        private long count;
        private double average;

        void add(long executionTimeMs) {
            count++;
            average = RunningAverage.fold(average, count, executionTimeMs);
        }

        double total() {
            return average * count;
        }
    }
}
