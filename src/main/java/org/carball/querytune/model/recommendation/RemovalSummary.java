package org.carball.querytune.model.recommendation;

public record RemovalSummary(
        int totalRecommendations,
        double totalSavings,
        int safeRemovals
) {}
