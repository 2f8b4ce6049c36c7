package org.carball.querytune.model.stats;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PerformanceTrend {
    IMPROVING,
    STABLE,
    DEGRADING;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
