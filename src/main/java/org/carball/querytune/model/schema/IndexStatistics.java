package org.carball.querytune.model.schema;

public record IndexStatistics(
        int totalIndexes,
        int uniqueIndexes,
        int partialIndexes
) {}
