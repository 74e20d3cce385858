package com.z254.insight.prism.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything one pipeline run produces. Consumers must treat it as read-only.
 */
@Value
@Builder
public class PipelineResult {

    NormalizationReport normalizationReport;

    /** Ordered by creation time, then id */
    List<EnrichedIssue> enrichedIssues;

    /** Table name to table, in requested order */
    Map<String, AggregationTable> tables;

    /** Table name to its first top-N categories */
    Map<String, List<CategoryTotal>> rankings;

    /** Table name to one series per category, for month-bucketed tables */
    Map<String, List<TrendSeries>> trends;

    AnalyticsSummary summary;

    public AggregationTable table(String name) {
        AggregationTable table = tables.get(name);
        if (table == null) {
            throw new IllegalArgumentException("No table named '" + name + "', available: " + tables.keySet());
        }
        return table;
    }
}
