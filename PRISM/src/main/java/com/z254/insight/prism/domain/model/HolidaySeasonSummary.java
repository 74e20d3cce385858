package com.z254.insight.prism.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Holiday-season share of the batch and holiday vs off-season resolution behaviour.
 */
@Value
@Builder
public class HolidaySeasonSummary {

    int holidaySeasonIssues;

    int offSeasonIssues;

    /** Holiday-season issues as a percentage of all issues, scale 2 */
    BigDecimal holidaySeasonPercentage;

    /** Issue count for every period, calendar order, fallback period last */
    Map<String, Integer> periodCounts;

    ResolutionSummary holidaySeason;

    ResolutionSummary offSeason;
}
