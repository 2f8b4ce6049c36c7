package org.carball.querytune.model.stats;

public record JoinSummary(
        int totalJoinPatterns,
        double avgPerformanceScore,
        int slowJoinPatterns
) {}
