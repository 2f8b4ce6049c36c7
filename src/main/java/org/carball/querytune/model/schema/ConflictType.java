package org.carball.querytune.model.schema;

public enum ConflictType {
    DUPLICATE(1.0),
    REDUNDANT(0.8),
    OVERLAPPING(0.6);

    private final double severity;

    ConflictType(double severity) {
        this.severity = severity;
    }

    public double getSeverity() {
        return severity;
    }
}
