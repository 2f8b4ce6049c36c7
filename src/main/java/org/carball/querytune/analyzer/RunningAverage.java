package org.carball.querytune.analyzer;

/**
 * Incremental mean shared by every tracker.
 */
public final class RunningAverage {

    private RunningAverage() {
        // Utility class - prevent instantiation
    }

    /**
     * Folds {@code value} into an average that already covers {@code count - 1} observations.
     *
     * @param count observation count after including {@code value}
     */
    public static double fold(double currentAverage, long count, double value) {
        if (count <= 1) {
            return value;
        }
        return (currentAverage * (count - 1) + value) / count;
    }
}
