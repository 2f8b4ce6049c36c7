package org.carball.querytune.model.recommendation;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskLevel {
    VERY_LOW("Very Low"),
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String label;

    RiskLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isSafe() {
        return this == VERY_LOW || this == LOW;
    }
}
