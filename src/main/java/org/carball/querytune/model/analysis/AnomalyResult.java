package org.carball.querytune.model.analysis;

/**
 * Verdict for a single execution time against the recent history.
 *
 * @param severity 0.0 for no anomaly up to 1.0
 */
public record AnomalyResult(
        boolean anomaly,
        AnomalyType type,
        double severity,
        String description,
        double baselineValue,
        double currentValue
) {}
