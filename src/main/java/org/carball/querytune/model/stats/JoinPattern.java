package org.carball.querytune.model.stats;

import lombok.Builder;
import lombok.Data;

@Data
@Builder(toBuilder = true)
public class JoinPattern {
    private final TablePair tables;
    private long joinCount;
    private double avgExecutionTimeMs;
    private JoinType joinType;
    private double performanceScore;
}
