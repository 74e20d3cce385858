package com.z254.insight.prism.config;

import com.z254.insight.prism.aggregate.TableSpec;
import com.z254.insight.prism.error.ConfigurationException;
import com.z254.insight.prism.extract.CustomerRule;
import com.z254.insight.prism.extract.PatternRule;
import com.z254.insight.prism.normalize.CanonicalField;
import com.z254.insight.prism.temporal.HolidayCalendar;
import com.z254.insight.prism.trend.TrendSettings;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

/**
 * Validated, immutable settings of one pipeline run.
 * <p>
 * Built from {@link PrismProperties} with {@link #from(PrismProperties)}, which compiles
 * every pattern and range up front and throws
 * {@link com.z254.insight.prism.error.ConfigurationException} listing all problems found.
 * Instances hold no mutable state and can be shared by concurrent runs.
 */
@Value
@Builder(toBuilder = true)
public class PipelineConfiguration {

    Map<CanonicalField, List<String>> fieldAliases;

    List<String> dateFormats;

    ZoneId zone;

    /** Integration apps in priority order */
    List<PatternRule> appRules;

    /** Customer rules in decreasing confidence */
    List<CustomerRule> customerRules;

    List<PatternRule> rootCauseRules;

    HolidayCalendar holidayCalendar;

    TrendSettings trendSettings;

    int maxRecords;

    /** Distance in months from the median creation month beyond which a record is rejected */
    int maxMonthSpan;

    boolean parallel;

    int topN;

    /** Inclusive; null when open */
    LocalDate startDate;

    LocalDate endDate;

    /** Null when every project is in scope */
    String projectKey;

    List<TableSpec> tables;

    public static PipelineConfiguration from(PrismProperties properties) {
        return new ConfigurationCompiler(properties).compile();
    }

    /**
     * Same configuration with a different analysis scope; null arguments keep the current value.
     */
    public PipelineConfiguration withScope(LocalDate start, LocalDate end, String project) {
        LocalDate newStart = start != null ? start : startDate;
        LocalDate newEnd = end != null ? end : endDate;
        if (newStart != null && newEnd != null && newStart.isAfter(newEnd)) {
            throw new ConfigurationException(List.of("start date " + newStart + " is after end date " + newEnd));
        }
        return toBuilder()
                .startDate(newStart)
                .endDate(newEnd)
                .projectKey(project != null && !project.isBlank() ? project.trim() : projectKey)
                .build();
    }

    /**
     * The built-in defaults of {@link PrismProperties}.
     */
    public static PipelineConfiguration defaults() {
        return from(new PrismProperties());
    }
}
