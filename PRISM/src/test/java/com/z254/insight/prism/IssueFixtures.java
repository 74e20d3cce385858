package com.z254.insight.prism;

import com.z254.insight.prism.domain.model.EnrichedIssue;
import com.z254.insight.prism.domain.model.ExtractionConfidence;
import com.z254.insight.prism.domain.model.Issue;

import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builders for raw records, issues and enriched issues used across the test suite.
 */
public final class IssueFixtures {

    private IssueFixtures() {
    }

    public static Map<String, Object> record(String key, String created, String summary) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("key", key);
        record.put("created", created);
        record.put("summary", summary);
        return record;
    }

    public static Map<String, Object> resolvedRecord(String key, String created, String resolved, String summary) {
        Map<String, Object> record = record(key, created, summary);
        record.put("resolved", resolved);
        record.put("resolution", "Fixed");
        return record;
    }

    public static Issue issue(String id, String createdAt, String summary) {
        return Issue.builder()
                .id(id)
                .summary(summary)
                .createdAt(Instant.parse(createdAt))
                .build();
    }

    public static EnrichedIssue enriched(String id, String month, String app) {
        return enriched(id, month, app, null);
    }

    public static EnrichedIssue enriched(String id, String month, String app, Duration resolutionTime) {
        YearMonth monthYear = YearMonth.parse(month);
        Instant created = monthYear.atDay(10).atStartOfDay().toInstant(ZoneOffset.UTC);
        return EnrichedIssue.builder()
                .issue(Issue.builder()
                        .id(id)
                        .summary(app + " issue")
                        .createdAt(created)
                        .resolvedAt(resolutionTime == null ? null : created.plus(resolutionTime))
                        .build())
                .monthYear(monthYear)
                .quarter((monthYear.getMonthValue() - 1) / 3 + 1)
                .resolutionTime(resolutionTime)
                .integrationApp(app)
                .customer(EnrichedIssue.UNKNOWN)
                .extractionConfidence(ExtractionConfidence.NONE)
                .rootCause(EnrichedIssue.UNKNOWN)
                .holidayPeriod("Off-Season")
                .holidaySeason(false)
                .build();
    }
}
