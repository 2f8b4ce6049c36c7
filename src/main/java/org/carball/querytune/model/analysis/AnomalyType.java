package org.carball.querytune.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AnomalyType {
    INSUFFICIENT_DATA,
    NORMAL,
    SUDDEN_SLOW,
    UNUSUAL_PATTERN;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
