package org.carball.querytune.model.stats;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
public class QueryFingerprint {

    public static final int MAX_SAMPLES = 5;

    private final String fingerprint;
    private long queryCount;
    private double avgExecutionTimeMs;
    @Builder.Default
    private List<String> sampleQueries = new ArrayList<>();
    @Builder.Default
    private PerformanceTrend trend = PerformanceTrend.STABLE;

    public void addSample(String query) {
        if (sampleQueries.size() < MAX_SAMPLES) {
            sampleQueries.add(query);
        }
    }

    public QueryFingerprint snapshot() {
        return toBuilder().sampleQueries(new ArrayList<>(sampleQueries)).build();
    }
}
