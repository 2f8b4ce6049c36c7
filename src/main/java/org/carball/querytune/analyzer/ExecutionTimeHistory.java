package org.carball.querytune.analyzer;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.Arrays;

/**
 * Sliding window over the most recent execution times. Once full, each new value evicts the oldest.
 */
public class ExecutionTimeHistory {

    public static final int DEFAULT_CAPACITY = 100;

    private final DescriptiveStatistics window;
    private final int capacity;

    public ExecutionTimeHistory() {
        this(DEFAULT_CAPACITY);
    }

    public ExecutionTimeHistory(int capacity) {
        this.capacity = capacity;
        this.window = new DescriptiveStatistics(capacity);
    }

    public void add(long executionTimeMs) {
        window.addValue(executionTimeMs);
    }

    public int size() {
        return (int) window.getN();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return window.getN() == 0;
    }

    /**
     * Median of the window: the middle value, or the mean of the two middle values for an even count.
     */
    public double median() {
        return isEmpty() ? 0.0 : window.getPercentile(50);
    }

    public double mean() {
        return isEmpty() ? 0.0 : window.getMean();
    }

    /**
     * Values oldest first.
     */
    public double[] values() {
        return window.getValues();
    }

    /**
     * Up to {@code count} most recent values, oldest first.
     */
    public double[] recent(int count) {
        return preceding(0, count);
    }

    /**
     * Up to {@code count} values that come before the {@code skip} most recent ones, oldest first.
     */
    public double[] preceding(int skip, int count) {
        double[] values = window.getValues();
        int end = Math.max(values.length - skip, 0);
        int start = Math.max(end - count, 0);
        return Arrays.copyOfRange(values, start, end);
    }

    public void clear() {
        window.clear();
    }
}
