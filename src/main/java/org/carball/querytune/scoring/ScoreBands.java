package org.carball.querytune.scoring;

import java.util.ArrayList;
import java.util.List;

/**
 * Step function over ordered (bound, score) bands. The first band whose bound the value passes wins;
 * otherwise the fallback score applies.
 */
public final class ScoreBands {

    private enum Direction { ABOVE, BELOW }

    private record Band(double bound, double score) {}

    private final Direction direction;
    private final List<Band> bands;
    private final double fallback;

    private ScoreBands(Direction direction, List<Band> bands, double fallback) {
        this.direction = direction;
        this.bands = List.copyOf(bands);
        this.fallback = fallback;
    }

    /**
     * Bands matched when the value is strictly greater than the bound, highest bound first.
     */
    public static Builder above() {
        return new Builder(Direction.ABOVE);
    }

    /**
     * Bands matched when the value is strictly less than the bound, lowest bound first.
     */
    public static Builder below() {
        return new Builder(Direction.BELOW);
    }

    public double score(double value) {
        for (Band band : bands) {
            boolean matches = direction == Direction.ABOVE ? value > band.bound() : value < band.bound();
            if (matches) {
                return band.score();
            }
        }
        return fallback;
    }

    public static final class Builder {
        private final Direction direction;
        private final List<Band> bands = new ArrayList<>();

        private Builder(Direction direction) {
            this.direction = direction;
        }

        public Builder band(double bound, double score) {
            bands.add(new Band(bound, score));
            return this;
        }

        public ScoreBands otherwise(double fallback) {
            return new ScoreBands(direction, bands, fallback);
        }
    }
}
