package org.carball.querytune.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PriorityLevel {
    CRITICAL("Critical", 0.8),
    HIGH("High", 0.6),
    MEDIUM("Medium", 0.4),
    LOW("Low", 0.2),
    VERY_LOW("Very Low", Double.NEGATIVE_INFINITY);

    private final String label;
    private final double minScore;

    PriorityLevel(String label, double minScore) {
        this.label = label;
        this.minScore = minScore;
    }

    public static PriorityLevel fromScore(double totalScore) {
        for (PriorityLevel level : values()) {
            if (totalScore >= level.minScore) {
                return level;
            }
        }
        return VERY_LOW;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
