package org.carball.querytune.model.analysis;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class PriorityScore {
    private String indexName;
    private double totalScore;
    private double frequencyScore;
    private double performanceScore;
    private double costScore;
    private double complexityScore;
    private PriorityLevel priorityLevel;
}
