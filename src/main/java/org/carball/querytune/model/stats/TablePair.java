package org.carball.querytune.model.stats;

/**
 * Unordered pair of joined tables. Construction through {@link #of} sorts the names, so
 * {@code of("a", "b")} and {@code of("b", "a")} are equal.
 */
public record TablePair(String first, String second) {

    public static TablePair of(String left, String right) {
        return left.compareTo(right) <= 0 ? new TablePair(left, right) : new TablePair(right, left);
    }

    @Override
    public String toString() {
        return first + "_JOIN_" + second;
    }
}
