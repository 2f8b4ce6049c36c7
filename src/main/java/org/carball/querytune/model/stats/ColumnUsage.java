package org.carball.querytune.model.stats;

import lombok.Builder;
import lombok.Data;

@Data
@Builder(toBuilder = true)
public class ColumnUsage {
    private final ColumnKey key;
    private long usageCount;
    private long whereCount;
    private long joinCount;
    private long orderByCount;
    private double avgQueryTimeMs;

    public String getTableName() {
        return key.table();
    }

    public String getColumnName() {
        return key.column();
    }

    public boolean isFilterOrJoinColumn() {
        return whereCount > 0 || joinCount > 0;
    }
}
