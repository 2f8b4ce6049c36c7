package org.carball.querytune.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MetricTrend {
    INCREASING,
    STABLE,
    DECREASING;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
