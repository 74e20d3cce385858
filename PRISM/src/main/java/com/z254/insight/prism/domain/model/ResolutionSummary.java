package com.z254.insight.prism.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Volume and resolution statistics for one group of issues (everything, one month, one category).
 */
@Value
@Builder
public class ResolutionSummary {

    String label;

    int totalIssues;

    int resolvedIssues;

    /** Resolved / total as a percentage, scale 2 */
    BigDecimal resolutionRate;

    /** Null when nothing in the group is resolved */
    BigDecimal averageResolutionDays;

    BigDecimal medianResolutionDays;
}
