package org.carball.querytune.analyzer;

import lombok.Getter;
import org.carball.querytune.model.query.QueryLog;
import org.carball.querytune.model.query.QueryShape;

/**
 * Owns one instance of each statistics tracker and feeds them from a single log stream.
 */
@Getter
public class WorkloadStatistics {

    private final ColumnTracker columnTracker = new ColumnTracker();
    private final JoinTracker joinTracker = new JoinTracker();
    private final TimeTracker timeTracker = new TimeTracker();
    private final FingerprintTracker fingerprintTracker = new FingerprintTracker();

    public void record(QueryLog queryLog, QueryShape shape) {
        long executionTimeMs = queryLog.executionTimeMs();

        columnTracker.record(shape, executionTimeMs);
        joinTracker.record(shape, executionTimeMs);
        timeTracker.record(queryLog.timestamp(), executionTimeMs);
        fingerprintTracker.record(queryLog.query(), executionTimeMs);
    }

    public void clear() {
        columnTracker.clear();
        joinTracker.clear();
        timeTracker.clear();
        fingerprintTracker.clear();
    }
}
