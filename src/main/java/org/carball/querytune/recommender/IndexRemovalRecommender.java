package org.carball.querytune.recommender;

import lombok.extern.slf4j.Slf4j;
import org.carball.querytune.config.AnalyzerThresholds;
import org.carball.querytune.model.recommendation.IndexUsageStats;
import org.carball.querytune.model.recommendation.RemovalRecommendation;
import org.carball.querytune.model.recommendation.RemovalSummary;
import org.carball.querytune.model.recommendation.RiskLevel;

import java.time.Clock;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Scores existing indexes for removal from their observed usage, benefit and maintenance cost.
 */
@Slf4j
public class IndexRemovalRecommender {

    public static final long DEFAULT_USAGE_THRESHOLD = 10;
    public static final long DEFAULT_UNUSED_SECONDS = 86400L * 30;
    public static final double DEFAULT_BENEFIT_THRESHOLD = 0.1;

    private static final double LOW_USAGE_WEIGHT = 0.3;
    private static final double NOT_RECENT_WEIGHT = 0.2;
    private static final double LOW_BENEFIT_WEIGHT = 0.4;
    private static final double NEVER_USED_WEIGHT = 0.5;
    private static final double MIN_CONFIDENCE = 0.5;

    private static final double STORAGE_SAVINGS = 50.0;
    private static final double REDUNDANT_CONFIDENCE = 0.7;
    private static final double REDUNDANT_SAVINGS = 30.0;

    private final long usageThreshold;
    private final long unusedSeconds;
    private final double benefitThreshold;
    private final Clock clock;

    public IndexRemovalRecommender() {
        this(DEFAULT_USAGE_THRESHOLD, DEFAULT_UNUSED_SECONDS, DEFAULT_BENEFIT_THRESHOLD, Clock.systemUTC());
    }

    public IndexRemovalRecommender(long usageThreshold, long unusedSeconds, double benefitThreshold, Clock clock) {
        this.usageThreshold = usageThreshold;
        this.unusedSeconds = unusedSeconds;
        this.benefitThreshold = benefitThreshold;
        this.clock = clock;
    }

    public static IndexRemovalRecommender fromThresholds(AnalyzerThresholds thresholds, Clock clock) {
        return new IndexRemovalRecommender(thresholds.getRemovalUsageThreshold(),
                thresholds.getRemovalUnusedSeconds(), thresholds.getRemovalBenefitThreshold(), clock);
    }

    /**
     * Removal candidates with confidence above 0.5, most confident first.
     */
    public List<RemovalRecommendation> analyzeIndexUsage(List<IndexUsageStats> usageStats) {
        long nowSeconds = clock.instant().getEpochSecond();

        List<RemovalRecommendation> recommendations = usageStats.stream()
                .map(stats -> evaluate(stats, nowSeconds))
                .flatMap(Optional::stream)
                .sorted(Comparator.comparingDouble(RemovalRecommendation::getConfidenceScore).reversed())
                .collect(Collectors.toList());

        log.debug("{} of {} indexes are removal candidates", recommendations.size(), usageStats.size());
        return recommendations;
    }

    private Optional<RemovalRecommendation> evaluate(IndexUsageStats stats, long nowSeconds) {
        List<String> reasons = new ArrayList<>();
        double confidence = 0.0;

        if (stats.getUsageCount() < usageThreshold) {
            reasons.add("Low usage frequency");
            confidence += LOW_USAGE_WEIGHT;
        }
        if (nowSeconds - stats.getLastUsed() > unusedSeconds) {
            reasons.add("Not used recently");
            confidence += NOT_RECENT_WEIGHT;
        }
        if (stats.getQueryBenefit() < stats.getMaintenanceCost() * benefitThreshold) {
            reasons.add("Low benefit compared to maintenance cost");
            confidence += LOW_BENEFIT_WEIGHT;
        }
        if (stats.getUsageCount() == 0) {
            reasons.add("Never used");
            confidence += NEVER_USED_WEIGHT;
        }

        if (confidence <= MIN_CONFIDENCE) {
            return Optional.empty();
        }

        return Optional.of(RemovalRecommendation.builder()
                .indexName(stats.getIndexName())
                .tableName(stats.getTableName())
                .removalReason(String.join(", ", reasons))
                .confidenceScore(confidence)
                .estimatedSavings(STORAGE_SAVINGS + stats.getMaintenanceCost() * 100.0)
                .riskLevel(riskLevelFor(confidence, stats.getUsageCount()))
                .sqlStatement(dropStatement(stats))
                .build());
    }

    static RiskLevel riskLevelFor(double confidence, long usageCount) {
        if (confidence > 0.8 && usageCount == 0) {
            return RiskLevel.VERY_LOW;
        } else if (confidence > 0.7 && usageCount < 5) {
            return RiskLevel.LOW;
        } else if (confidence > 0.6) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.HIGH;
    }

    private static String dropStatement(IndexUsageStats stats) {
        return String.format("DROP INDEX %s ON %s", stats.getIndexName(), stats.getTableName());
    }

    /**
     * For every table with several indexes, all but the most used one.
     */
    public List<RemovalRecommendation> findRedundantIndexes(List<IndexUsageStats> indexes) {
        Map<String, List<IndexUsageStats>> byTable = new LinkedHashMap<>();
        for (IndexUsageStats index : indexes) {
            byTable.computeIfAbsent(index.getTableName(), table -> new ArrayList<>()).add(index);
        }

        List<RemovalRecommendation> redundant = new ArrayList<>();
        for (List<IndexUsageStats> tableIndexes : byTable.values()) {
            if (tableIndexes.size() <= 1) {
                continue;
            }

            List<IndexUsageStats> sorted = new ArrayList<>(tableIndexes);
            sorted.sort(Comparator.comparingLong(IndexUsageStats::getUsageCount));
            for (IndexUsageStats index : sorted.subList(0, sorted.size() - 1)) {
                redundant.add(RemovalRecommendation.builder()
                        .indexName(index.getIndexName())
                        .tableName(index.getTableName())
                        .removalReason("Redundant - lower usage than other indexes")
                        .confidenceScore(REDUNDANT_CONFIDENCE)
                        .estimatedSavings(REDUNDANT_SAVINGS)
                        .riskLevel(RiskLevel.MEDIUM)
                        .sqlStatement(dropStatement(index))
                        .build());
            }
        }
        return redundant;
    }

    public List<RemovalRecommendation> getSafeRemovalCandidates(List<RemovalRecommendation> recommendations) {
        return recommendations.stream()
                .filter(recommendation -> recommendation.getRiskLevel().isSafe())
                .collect(Collectors.toList());
    }

    public RemovalSummary getRemovalSummary(List<RemovalRecommendation> recommendations) {
        double totalSavings = recommendations.stream()
                .mapToDouble(RemovalRecommendation::getEstimatedSavings)
                .sum();
        return new RemovalSummary(recommendations.size(), totalSavings,
                getSafeRemovalCandidates(recommendations).size());
    }
}
