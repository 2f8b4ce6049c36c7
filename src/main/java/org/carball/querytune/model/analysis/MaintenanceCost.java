package org.carball.querytune.model.analysis;

import lombok.Builder;
import lombok.Data;

/**
 * Estimated write-path overhead of keeping one index, in milliseconds per write.
 */
@Data
@Builder
public class MaintenanceCost {
    private String indexName;
    private String tableName;
    private double writeOverheadPercent;
    private double insertCostMs;
    private double updateCostMs;
    private double deleteCostMs;
    private double totalMaintenanceCost;
    private String recommendation;
}
