package com.z254.insight.prism.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;
import java.time.YearMonth;
import java.util.Optional;

/**
 * An {@link Issue} plus the attributes derived by the enrichment stage.
 */
@Value
@Builder(toBuilder = true)
public class EnrichedIssue {

    public static final String UNKNOWN = "Unknown";

    @NonNull
    Issue issue;

    /** Year and month of creation in the configured zone */
    @NonNull
    YearMonth monthYear;

    /** 1-based quarter of creation */
    int quarter;

    /** Absent when the issue is unresolved */
    Duration resolutionTime;

    @NonNull
    String integrationApp;

    @NonNull
    String customer;

    @NonNull
    ExtractionConfidence extractionConfidence;

    /** Source root cause, or the classified one, or {@value #UNKNOWN} */
    @NonNull
    String rootCause;

    @NonNull
    String holidayPeriod;

    /** False only for the off-season fallback period */
    boolean holidaySeason;

    @JsonIgnore
    public String getId() {
        return issue.getId();
    }

    @JsonIgnore
    public Optional<Duration> resolutionTime() {
        return Optional.ofNullable(resolutionTime);
    }

    /**
     * Resolution time in fractional days, absent when unresolved.
     */
    @JsonIgnore
    public Optional<Double> resolutionDays() {
        return resolutionTime().map(duration -> duration.toMillis() / (double) Duration.ofDays(1).toMillis());
    }

    public String getMonthBucket() {
        return monthYear.toString();
    }

    public String getQuarterBucket() {
        return monthYear.getYear() + "-Q" + quarter;
    }
}
