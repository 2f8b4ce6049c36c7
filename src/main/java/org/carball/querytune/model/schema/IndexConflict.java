package org.carball.querytune.model.schema;

public record IndexConflict(
        String recommendedIndex,
        String existingIndex,
        ConflictType conflictType,
        double severity
) {}
