package org.carball.querytune.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.querytune.config.AnalyzerThresholds;
import org.carball.querytune.model.analysis.AnalysisResult;
import org.carball.querytune.model.analysis.AnomalyResult;
import org.carball.querytune.model.analysis.PerformanceAlert;
import org.carball.querytune.model.analysis.QueryCost;
import org.carball.querytune.model.query.QueryLog;
import org.carball.querytune.model.query.QueryPattern;
import org.carball.querytune.model.query.QueryShape;
import org.carball.querytune.model.query.QueryType;
import org.carball.querytune.model.recommendation.IndexRecommendation;
import org.carball.querytune.model.recommendation.PerformancePrediction;
import org.carball.querytune.parser.QueryShapeExtractor;
import org.carball.querytune.parser.QueryShapeParser;
import org.carball.querytune.recommender.IndexRecommender;
import org.carball.querytune.recommender.PerformancePredictor;
import org.carball.querytune.scoring.AnomalyDetector;
import org.carball.querytune.scoring.CostCalculator;
import org.carball.querytune.scoring.PerformanceMonitor;

import java.util.Collection;
import java.util.List;

/**
 * Entry point: feeds each query log through the parser, the trackers, the predictor and the anomaly
 * detector, and assembles an {@link AnalysisResult} on demand.
 */
@Slf4j
public class QueryLogAnalyzer {

    private final AnalyzerThresholds thresholds;
    private final QueryShapeParser parser;
    private final WorkloadStatistics statistics = new WorkloadStatistics();
    private final PatternAnalyzer patternAnalyzer = new PatternAnalyzer();
    private final PerformancePredictor predictor;
    private final AnomalyDetector anomalyDetector;
    private final CostCalculator costCalculator = new CostCalculator();
    private final PerformanceMonitor performanceMonitor = new PerformanceMonitor();

    public QueryLogAnalyzer() {
        this(AnalyzerThresholds.defaults());
    }

    public QueryLogAnalyzer(AnalyzerThresholds thresholds) {
        this(thresholds, new QueryShapeExtractor());
    }

    public QueryLogAnalyzer(AnalyzerThresholds thresholds, QueryShapeParser parser) {
        this.thresholds = thresholds;
        this.parser = parser;
        this.predictor = new PerformancePredictor(thresholds.isCacheEnabled());
        this.anomalyDetector = new AnomalyDetector(thresholds.getAnomalyHistorySize(),
                thresholds.getAnomalyMinSamples(), thresholds.getAnomalyDeviationThreshold());

        thresholds.validate();
        log.info("Initialized QueryLogAnalyzer: {}", thresholds.getConfigurationSummary());
    }

    public void ingest(QueryLog queryLog) {
        if (queryLog.query().isBlank()) {
            log.warn("Query log at {} has no statement text; only timing statistics will be recorded",
                    queryLog.timestamp());
        }

        QueryShape shape = parser.extract(queryLog.query());
        statistics.record(queryLog, shape);
        patternAnalyzer.addLog(queryLog);
        predictor.addHistoricalData(queryLog);
        anomalyDetector.recordExecutionTime(queryLog.executionTimeMs());
        performanceMonitor.recordMetric(PerformanceMonitor.QUERY_TIME, queryLog.executionTimeMs(), "ms");

        if (queryLog.isSlow(thresholds.getSlowQueryThresholdMs())) {
            log.debug("Slow {} query ({} ms): {}", queryLog.queryType(), queryLog.executionTimeMs(), shape.fingerprint());
        }
    }

    public void ingestAll(Collection<QueryLog> queryLogs) {
        queryLogs.forEach(this::ingest);
        log.info("Ingested {} query logs ({} total)", queryLogs.size(), patternAnalyzer.totalQueries());
    }

    public AnalysisResult analyze() {
        List<QueryPattern> patterns = patternAnalyzer.analyze();

        IndexRecommender recommender = new IndexRecommender(thresholds.getSlownessThreshold(),
                thresholds.getFrequencyThreshold(), statistics.getColumnTracker());
        List<IndexRecommendation> recommendations = recommender.recommend(patterns);

        AnalysisResult result = new AnalysisResult(
                patternAnalyzer.totalQueries(),
                patterns,
                patternAnalyzer.getPerformanceSummary(),
                recommendations,
                statistics.getColumnTracker().getMostUsedColumns(thresholds.getTopColumnsLimit()),
                statistics.getJoinTracker().getFrequentJoins(thresholds.getFrequentJoinsLimit()),
                statistics.getTimeTracker().getHourlyPatterns(),
                statistics.getTimeTracker().getDailyPatterns(),
                statistics.getFingerprintTracker().getPerformanceInsights(),
                anomalyDetector.getAnomalySummary());

        log.info("Analysis complete. {} patterns, {} index recommendations", patterns.size(), recommendations.size());
        return result;
    }

    public PerformancePrediction predict(QueryType queryType, long rowsToScan) {
        return predictor.predict(queryType, rowsToScan);
    }

    public AnomalyResult detectAnomaly(long executionTimeMs) {
        return anomalyDetector.detectAnomaly(executionTimeMs);
    }

    /**
     * Alerts raised by the latest recorded query time, plus any other metrics fed to the monitor.
     */
    public List<PerformanceAlert> checkAlerts() {
        return performanceMonitor.checkAlerts();
    }

    public QueryCost estimateCost(QueryLog queryLog) {
        QueryShape shape = parser.extract(queryLog.query());
        return costCalculator.calculateFromShape(shape, queryLog.executionTimeMs(), queryLog.rowsScanned());
    }

    public WorkloadStatistics getStatistics() {
        return statistics;
    }

    public PatternAnalyzer getPatternAnalyzer() {
        return patternAnalyzer;
    }

    public AnomalyDetector getAnomalyDetector() {
        return anomalyDetector;
    }

    public PerformanceMonitor getPerformanceMonitor() {
        return performanceMonitor;
    }

    public void clear() {
        statistics.clear();
        patternAnalyzer.clear();
        predictor.clear();
        anomalyDetector.clear();
        performanceMonitor.clear();
        log.debug("Cleared all accumulated statistics");
    }
}
