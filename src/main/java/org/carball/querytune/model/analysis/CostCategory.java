package org.carball.querytune.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CostCategory {
    LOW(10.0),
    MEDIUM(100.0),
    HIGH(Double.POSITIVE_INFINITY);

    private final double upperBound;

    CostCategory(double upperBound) {
        this.upperBound = upperBound;
    }

    public static CostCategory fromTotal(double totalCost) {
        for (CostCategory category : values()) {
            if (totalCost < category.upperBound) {
                return category;
            }
        }
        return HIGH;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
