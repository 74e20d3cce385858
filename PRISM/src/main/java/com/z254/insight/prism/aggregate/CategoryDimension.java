package com.z254.insight.prism.aggregate;

import com.z254.insight.prism.domain.model.EnrichedIssue;

import java.util.function.Function;

/**
 * Row axis of an aggregation table. Blank values are reported as {@link EnrichedIssue#UNKNOWN}.
 */
public enum CategoryDimension {

    INTEGRATION_APP("integration_app", EnrichedIssue::getIntegrationApp),
    CUSTOMER("customer", EnrichedIssue::getCustomer),
    RESOLUTION("resolution", issue -> issue.getIssue().getResolution()),
    ROOT_CAUSE("root_cause", EnrichedIssue::getRootCause),
    PRIORITY("priority", issue -> issue.getIssue().getPriority()),
    STATUS("status", issue -> issue.getIssue().getStatus()),
    ISSUE_TYPE("issue_type", issue -> issue.getIssue().getIssueType()),
    HOLIDAY_PERIOD("holiday_period", EnrichedIssue::getHolidayPeriod);

    private final String key;
    private final Function<EnrichedIssue, String> selector;

    CategoryDimension(String key, Function<EnrichedIssue, String> selector) {
        this.key = key;
        this.selector = selector;
    }

    public String getKey() {
        return key;
    }

    public String select(EnrichedIssue issue) {
        String value = selector.apply(issue);
        return value == null || value.isBlank() ? EnrichedIssue.UNKNOWN : value.trim();
    }
}
