package org.carball.querytune.model.recommendation;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class IndexRecommendation {
    private String table;
    private String column;
    private IndexType indexType;
    private int priority;
    private double estimatedImprovementPercent;
    private String reason;

    public String toCreateStatement() {
        String using = indexType == IndexType.HASH ? " USING HASH" : "";
        return String.format("CREATE INDEX idx_%s_%s ON %s%s (%s)", table, column, table, using, column);
    }
}
