package org.carball.querytune.model.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate over all logged statements of one {@link QueryType}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryPattern {
    private QueryType queryType;
    private double avgExecutionTimeMs;
    private long frequency;
    @Builder.Default
    private List<String> tables = new ArrayList<>();
    private double slownessScore;
    private long totalRowsScanned;
}
