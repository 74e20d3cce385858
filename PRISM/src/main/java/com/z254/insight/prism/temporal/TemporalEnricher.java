package com.z254.insight.prism.temporal;

import com.z254.insight.prism.domain.model.Issue;
import lombok.Value;

import java.time.Duration;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;

/**
 * Derives calendar buckets, resolution time and holiday period from an issue's timestamps.
 * Calendar fields are taken in the configured zone.
 */
public class TemporalEnricher {

    private final ZoneId zone;
    private final HolidayCalendar calendar;

    public TemporalEnricher(ZoneId zone, HolidayCalendar calendar) {
        this.zone = zone;
        this.calendar = calendar;
    }

    public TemporalAttributes enrich(Issue issue) {
        LocalDate created = issue.getCreatedAt().atZone(zone).toLocalDate();
        String period = calendar.classify(created);
        return new TemporalAttributes(
                YearMonth.from(created),
                (created.getMonthValue() - 1) / 3 + 1,
                resolutionTime(issue),
                period,
                calendar.isHolidaySeason(period));
    }

    /**
     * {@code resolvedAt - createdAt}, or null for unresolved issues. Never negative: the
     * normalizer drops resolution timestamps that precede creation.
     */
    Duration resolutionTime(Issue issue) {
        if (issue.getResolvedAt() == null) {
            return null;
        }
        Duration duration = Duration.between(issue.getCreatedAt(), issue.getResolvedAt());
        return duration.isNegative() ? null : duration;
    }

    public HolidayCalendar getCalendar() {
        return calendar;
    }

    @Value
    public static class TemporalAttributes {
        YearMonth monthYear;
        int quarter;
        Duration resolutionTime;
        String holidayPeriod;
        boolean holidaySeason;
    }
}
