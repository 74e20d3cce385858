package com.z254.insight.prism.temporal;

import com.z254.insight.prism.config.PipelineConfiguration;
import com.z254.insight.prism.domain.model.Issue;
import com.z254.insight.prism.temporal.TemporalEnricher.TemporalAttributes;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static com.z254.insight.prism.IssueFixtures.issue;
import static org.assertj.core.api.Assertions.assertThat;

class TemporalEnricherTest {

    private final HolidayCalendar calendar = PipelineConfiguration.defaults().getHolidayCalendar();
    private final TemporalEnricher enricher = new TemporalEnricher(ZoneOffset.UTC, calendar);

    @Test
    void derivesMonthQuarterAndPeriod() {
        TemporalAttributes attributes = enricher.enrich(issue("INT-1", "2024-11-29T15:00:00Z", "Cyber weekend"));

        assertThat(attributes.getMonthYear()).isEqualTo(YearMonth.of(2024, 11));
        assertThat(attributes.getQuarter()).isEqualTo(4);
        assertThat(attributes.getHolidayPeriod()).isEqualTo("Cyber Monday");
        assertThat(attributes.isHolidaySeason()).isTrue();
        assertThat(attributes.getResolutionTime()).isNull();
    }

    @Test
    void resolutionTimeIsResolvedMinusCreated() {
        Issue resolved = issue("INT-2", "2024-02-01T08:00:00Z", "Fixed").toBuilder()
                .resolvedAt(Instant.parse("2024-02-03T20:00:00Z"))
                .build();

        TemporalAttributes attributes = enricher.enrich(resolved);

        assertThat(attributes.getResolutionTime()).isEqualTo(Duration.ofHours(60));
        assertThat(attributes.getQuarter()).isEqualTo(1);
        assertThat(attributes.getHolidayPeriod()).isEqualTo("Off-Season");
    }

    @Test
    void calendarFieldsFollowConfiguredZone() {
        // 2025-01-01T03:00Z is still Dec 31 in Los Angeles
        TemporalEnricher losAngeles = new TemporalEnricher(ZoneId.of("America/Los_Angeles"), calendar);

        TemporalAttributes attributes = losAngeles.enrich(issue("INT-3", "2025-01-01T03:00:00Z", "Late night"));

        assertThat(attributes.getMonthYear()).isEqualTo(YearMonth.of(2024, 12));
        assertThat(attributes.getHolidayPeriod()).isEqualTo("Christmas Week");
    }
}
