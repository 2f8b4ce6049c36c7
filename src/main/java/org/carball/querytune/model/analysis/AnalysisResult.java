package org.carball.querytune.model.analysis;

import org.carball.querytune.model.query.QueryPattern;
import org.carball.querytune.model.recommendation.IndexRecommendation;
import org.carball.querytune.model.stats.ColumnUsage;
import org.carball.querytune.model.stats.JoinPattern;
import org.carball.querytune.model.stats.TimePattern;

import java.util.List;

public record AnalysisResult(
        long totalQueries,
        List<QueryPattern> queryPatterns,
        PatternSummary patternSummary,
        List<IndexRecommendation> indexRecommendations,
        List<ColumnUsage> topColumns,
        List<JoinPattern> frequentJoins,
        List<TimePattern> hourlyPatterns,
        List<TimePattern> dailyPatterns,
        List<String> fingerprintInsights,
        AnomalySummary anomalySummary
) {}
