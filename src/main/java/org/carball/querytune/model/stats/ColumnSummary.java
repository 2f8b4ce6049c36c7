package org.carball.querytune.model.stats;

public record ColumnSummary(
        double avgUsage,
        int totalColumns,
        int indexingCandidates
) {}
