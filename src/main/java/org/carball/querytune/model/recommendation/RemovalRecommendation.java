package org.carball.querytune.model.recommendation;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class RemovalRecommendation {
    private String indexName;
    private String tableName;
    private String removalReason;
    private double confidenceScore;
    private double estimatedSavings;
    private RiskLevel riskLevel;
    private String sqlStatement;
}
