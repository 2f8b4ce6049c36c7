package org.carball.querytune.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.querytune.model.analysis.AnalysisResult;
import org.carball.querytune.model.query.QueryPattern;
import org.carball.querytune.model.recommendation.IndexRecommendation;
import org.carball.querytune.model.stats.ColumnUsage;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Renders an {@link AnalysisResult} as JSON, CSV or Markdown text.
 */
@Slf4j
public class TuningReport {

    static final String CSV_HEADER = "table,column,index_type,priority,estimated_improvement_percent,reason";

    private final AnalysisResult analysisResult;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public TuningReport(AnalysisResult analysisResult) {
        this.analysisResult = analysisResult;
        this.timestamp = LocalDateTime.now();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            ReportData reportData = new ReportData();
            reportData.setGeneratedAt(timestamp);
            reportData.setAnalysis(analysisResult);
            return objectMapper.writeValueAsString(reportData);
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    /**
     * One row per index recommendation, priority order preserved.
     */
    public String toCsv() {
        StringBuilder csv = new StringBuilder(CSV_HEADER).append('\n');
        for (IndexRecommendation rec : analysisResult.indexRecommendations()) {
            csv.append(escape(rec.getTable())).append(',')
                    .append(escape(rec.getColumn())).append(',')
                    .append(rec.getIndexType().getDisplayName()).append(',')
                    .append(rec.getPriority()).append(',')
                    .append(String.format(Locale.ROOT, "%.2f", rec.getEstimatedImprovementPercent())).append(',')
                    .append(escape(rec.getReason()))
                    .append('\n');
        }
        return csv.toString();
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# Query Log Tuning Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n\n");

        md.append("## Overview\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Queries Analyzed | ").append(analysisResult.totalQueries()).append(" |\n");
        md.append("| Query Patterns | ").append(analysisResult.queryPatterns().size()).append(" |\n");
        md.append("| Slow Queries | ").append(analysisResult.patternSummary().slowQueryCount()).append(" |\n");
        md.append("| Index Recommendations | ").append(analysisResult.indexRecommendations().size()).append(" |\n");
        md.append("| Anomalies | ").append(analysisResult.anomalySummary().anomalyCount()).append(" |\n\n");

        md.append("## Query Patterns\n\n");
        if (analysisResult.queryPatterns().isEmpty()) {
            md.append("No queries analyzed.\n\n");
        } else {
            md.append("| Type | Frequency | Avg Time (ms) | Tables |\n");
            md.append("|------|-----------|---------------|--------|\n");
            for (QueryPattern pattern : analysisResult.queryPatterns()) {
                md.append(String.format(Locale.ROOT, "| %s | %d | %.2f | %s |\n", pattern.getQueryType(),
                        pattern.getFrequency(), pattern.getAvgExecutionTimeMs(), String.join(", ", pattern.getTables())));
            }
            md.append('\n');
        }

        md.append("## Index Recommendations\n\n");
        List<IndexRecommendation> recommendations = analysisResult.indexRecommendations();
        if (recommendations.isEmpty()) {
            md.append("No indexes recommended.\n\n");
        } else {
            for (IndexRecommendation rec : recommendations) {
                md.append(String.format(Locale.ROOT, "- **%s.%s** (%s, priority %d, ~%.0f%% faster): `%s`\n",
                        rec.getTable(), rec.getColumn(), rec.getIndexType().getDisplayName(), rec.getPriority(),
                        rec.getEstimatedImprovementPercent(), rec.toCreateStatement()));
            }
            md.append('\n');
        }

        if (!analysisResult.topColumns().isEmpty()) {
            md.append("## Most Used Columns\n\n");
            for (ColumnUsage usage : analysisResult.topColumns()) {
                md.append(String.format("- %s: %d uses\n", usage.getKey(), usage.getUsageCount()));
            }
            md.append('\n');
        }

        if (!analysisResult.fingerprintInsights().isEmpty()) {
            md.append("## Insights\n\n");
            analysisResult.fingerprintInsights().forEach(insight -> md.append("- ").append(insight).append('\n'));
        }

        return md.toString();
    }

    @lombok.Data
    private static class ReportData {
        private LocalDateTime generatedAt;
        private AnalysisResult analysis;
    }
}
