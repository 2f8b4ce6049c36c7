package org.carball.querytune.model.recommendation;

public record RoiAnalysis(
        double roiScore,
        String recommendation
) {}
