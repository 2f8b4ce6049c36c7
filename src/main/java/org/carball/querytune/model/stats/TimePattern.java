package org.carball.querytune.model.stats;

/**
 * Snapshot of one time bucket. Hourly buckets report {@code dayOfWeek} 0, daily buckets report {@code hour} 0.
 *
 * @param dayOfWeek 0 = Sunday
 */
public record TimePattern(
        int hour,
        int dayOfWeek,
        long queryCount,
        double avgExecutionTimeMs,
        boolean peak
) {}
