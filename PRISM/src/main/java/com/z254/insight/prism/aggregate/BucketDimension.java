package com.z254.insight.prism.aggregate;

import com.z254.insight.prism.domain.model.EnrichedIssue;

import java.util.function.Function;

/**
 * Column axis of an aggregation table.
 */
public enum BucketDimension {

    MONTH("month", EnrichedIssue::getMonthBucket),
    QUARTER("quarter", EnrichedIssue::getQuarterBucket),
    HOLIDAY_PERIOD("holiday_period", EnrichedIssue::getHolidayPeriod);

    private final String key;
    private final Function<EnrichedIssue, String> selector;

    BucketDimension(String key, Function<EnrichedIssue, String> selector) {
        this.key = key;
        this.selector = selector;
    }

    public String getKey() {
        return key;
    }

    public String select(EnrichedIssue issue) {
        return selector.apply(issue);
    }
}
