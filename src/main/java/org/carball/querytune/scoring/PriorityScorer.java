package org.carball.querytune.scoring;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.carball.querytune.config.AnalyzerThresholds;
import org.carball.querytune.config.OperatingMode;
import org.carball.querytune.model.analysis.PriorityLevel;
import org.carball.querytune.model.analysis.PriorityScore;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Weighted four-factor priority for a candidate index.
 */
@Slf4j
@Getter
public class PriorityScorer {

    private static final ScoreBands FREQUENCY_BANDS = ScoreBands.above()
            .band(1000, 1.0)
            .band(500, 0.8)
            .band(100, 0.6)
            .band(10, 0.4)
            .otherwise(0.2);

    private static final ScoreBands PERFORMANCE_BANDS = ScoreBands.above()
            .band(50.0, 1.0)
            .band(25.0, 0.8)
            .band(10.0, 0.6)
            .band(5.0, 0.4)
            .otherwise(0.2);

    private static final ScoreBands MAINTENANCE_COST_BANDS = ScoreBands.below()
            .band(2.0, 1.0)
            .band(5.0, 0.8)
            .band(10.0, 0.6)
            .band(20.0, 0.4)
            .otherwise(0.2);

    private static final ScoreBands COMPLEXITY_BANDS = ScoreBands.below()
            .band(0.2, 1.0)
            .band(0.4, 0.8)
            .band(0.6, 0.6)
            .band(0.8, 0.4)
            .otherwise(0.2);

    private double frequencyWeight;
    private double performanceWeight;
    private double costWeight;
    private double complexityWeight;

    public PriorityScorer() {
        this(0.3, 0.4, 0.2, 0.1);
    }

    public PriorityScorer(double frequencyWeight, double performanceWeight,
                          double costWeight, double complexityWeight) {
        this.frequencyWeight = frequencyWeight;
        this.performanceWeight = performanceWeight;
        this.costWeight = costWeight;
        this.complexityWeight = complexityWeight;
    }

    /**
     * Scorer with the configured weights, adjusted for the configured operating mode.
     */
    public static PriorityScorer fromThresholds(AnalyzerThresholds thresholds) {
        PriorityScorer scorer = new PriorityScorer(thresholds.getFrequencyWeight(), thresholds.getPerformanceWeight(),
                thresholds.getCostWeight(), thresholds.getComplexityWeight());
        scorer.adjustWeights(thresholds.getOperatingMode());
        return scorer;
    }

    public PriorityScore calculatePriorityScore(String indexName, long frequency, double performanceImpact,
                                                double maintenanceCost, double complexity) {
        double frequencyScore = FREQUENCY_BANDS.score(frequency);
        double performanceScore = PERFORMANCE_BANDS.score(performanceImpact);
        double costScore = MAINTENANCE_COST_BANDS.score(maintenanceCost);
        double complexityScore = COMPLEXITY_BANDS.score(complexity);

        double totalScore = frequencyScore * frequencyWeight
                + performanceScore * performanceWeight
                + costScore * costWeight
                + complexityScore * complexityWeight;

        return PriorityScore.builder()
                .indexName(indexName)
                .totalScore(totalScore)
                .frequencyScore(frequencyScore)
                .performanceScore(performanceScore)
                .costScore(costScore)
                .complexityScore(complexityScore)
                .priorityLevel(PriorityLevel.fromScore(totalScore))
                .build();
    }

    /**
     * Overrides weights for the given workload traits, applied read-heavy, then write-heavy, then
     * storage-constrained. Later traits win where they touch the same weight.
     */
    public void adjustWeights(boolean readHeavy, boolean writeHeavy, boolean storageConstrained) {
        if (readHeavy) {
            performanceWeight = 0.5;
            frequencyWeight = 0.3;
        }
        if (writeHeavy) {
            costWeight = 0.4;
            performanceWeight = 0.3;
        }
        if (storageConstrained) {
            costWeight = 0.5;
            complexityWeight = 0.2;
        }
        log.debug("Priority weights now frequency={}, performance={}, cost={}, complexity={}",
                frequencyWeight, performanceWeight, costWeight, complexityWeight);
    }

    public void adjustWeights(OperatingMode mode) {
        adjustWeights(mode.isReadHeavy(), mode.isWriteHeavy(), mode.isStorageConstrained());
    }

    public List<PriorityScore> rankIndexes(List<PriorityScore> scores) {
        return scores.stream()
                .sorted(Comparator.comparingDouble(PriorityScore::getTotalScore).reversed())
                .collect(Collectors.toList());
    }

    public List<PriorityScore> getTopPriorities(List<PriorityScore> scores, int limit) {
        return rankIndexes(scores).stream()
                .limit(limit)
                .collect(Collectors.toList());
    }

    /**
     * Gain scaled by how often the index would be hit, per unit of maintenance cost.
     */
    public double calculateRoiScore(double performanceGain, double maintenanceCost, long frequency) {
        if (maintenanceCost == 0.0) {
            return performanceGain;
        }
        double frequencyFactor = Math.min(frequency / 1000.0, 1.0);
        return performanceGain * frequencyFactor / maintenanceCost;
    }
}
