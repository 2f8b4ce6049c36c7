package org.carball.querytune.model.recommendation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Observed usage of an existing index.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexUsageStats {
    private String indexName;
    private String tableName;
    private long usageCount;
    /** Epoch seconds of the last recorded use. */
    private long lastUsed;
    private double queryBenefit;
    private double maintenanceCost;
}
