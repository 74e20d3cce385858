package com.z254.insight.prism.temporal;

import com.z254.insight.prism.config.PipelineConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.time.MonthDay;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HolidayCalendarTest {

    private HolidayCalendar calendar;

    @BeforeEach
    void setUp() {
        calendar = PipelineConfiguration.defaults().getHolidayCalendar();
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "2024-12-26, Christmas Week",
            "2025-01-01, Christmas Week",
            "2025-01-02, New Year Recovery",
            "2024-07-04, Off-Season",
            "2024-11-19, Off-Season",
            "2024-11-20, Black Friday Week",
            "2024-11-27, Black Friday Week",
            "2024-11-28, Cyber Monday",
            "2024-12-01, Cyber Monday",
            "2024-12-02, Holiday Shopping",
            "2024-12-24, Holiday Shopping",
            "2024-12-25, Christmas Week",
            "2024-12-31, Christmas Week",
            "2025-01-15, New Year Recovery",
            "2025-01-16, Off-Season"
    })
    void classifiesByPriorityOrder(LocalDate date, String expected) {
        assertThat(calendar.classify(date)).isEqualTo(expected);
    }

    @Test
    void everyDayOfTheYearMapsToExactlyOneKnownPeriod() {
        List<String> periods = calendar.periodNames();
        for (LocalDate day = LocalDate.of(2024, 1, 1); day.getYear() == 2024; day = day.plusDays(1)) {
            assertThat(periods).contains(calendar.classify(day));
        }
        assertThat(periods).containsExactly("Black Friday Week", "Cyber Monday", "Holiday Shopping",
                "Christmas Week", "New Year Recovery", "Off-Season");
    }

    @Test
    void reorderingRangesChangesPrecedence() {
        HolidayRange christmas = new HolidayRange("Christmas Week", MonthDay.of(12, 24), MonthDay.of(1, 1));
        HolidayRange newYear = new HolidayRange("New Year Recovery", MonthDay.of(1, 1), MonthDay.of(1, 15));
        HolidayCalendar reordered = new HolidayCalendar(List.of(newYear, christmas), "Off-Season");

        assertThat(reordered.classify(LocalDate.of(2025, 1, 1))).isEqualTo("New Year Recovery");
        assertThat(reordered.classify(LocalDate.of(2024, 12, 28))).isEqualTo("Christmas Week");
    }

    @Test
    void wrappingRangeCoversBothSidesOfTheYearBoundary() {
        HolidayRange christmas = new HolidayRange("Christmas Week", MonthDay.of(12, 24), MonthDay.of(1, 1));

        assertThat(christmas.crossesYearBoundary()).isTrue();
        assertThat(christmas.contains(MonthDay.of(12, 24))).isTrue();
        assertThat(christmas.contains(MonthDay.of(1, 1))).isTrue();
        assertThat(christmas.contains(MonthDay.of(1, 2))).isFalse();
        assertThat(christmas.contains(MonthDay.of(12, 23))).isFalse();
    }

    @Test
    void offSeasonIsTheOnlyNonHolidayPeriod() {
        assertThat(calendar.isHolidaySeason("Off-Season")).isFalse();
        assertThat(calendar.isHolidaySeason("Cyber Monday")).isTrue();
    }
}
