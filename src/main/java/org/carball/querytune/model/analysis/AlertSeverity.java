package org.carball.querytune.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Grade of a metric value against its alert threshold: above 2x is critical, above 1.5x a warning.
 */
public enum AlertSeverity {
    NORMAL,
    WARNING,
    CRITICAL;

    public static AlertSeverity fromRatio(double valueToThreshold) {
        if (valueToThreshold > 2.0) {
            return CRITICAL;
        }
        if (valueToThreshold > 1.5) {
            return WARNING;
        }
        return NORMAL;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
