package com.z254.insight.prism.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Reporting summaries computed next to the aggregation tables.
 */
@Value
@Builder
public class AnalyticsSummary {

    ResolutionSummary overall;

    /** One entry per month bucket, oldest first */
    List<ResolutionSummary> monthly;

    /** Category dimension to per-category summaries in ranking order */
    Map<String, List<ResolutionSummary>> byCategory;

    HolidaySeasonSummary holidaySeason;
}
