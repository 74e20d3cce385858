package com.z254.insight.prism.temporal;

import lombok.Getter;

import java.time.LocalDate;
import java.time.MonthDay;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, named holiday ranges with an off-season fallback.
 * <p>
 * Classification is total: the ranges are tried in priority order and the first one that
 * contains the date wins, so overlapping boundaries (Jan 1 sits in both Christmas Week and
 * New Year Recovery) resolve by position in the list alone.
 */
@Getter
public final class HolidayCalendar {

    private final List<HolidayRange> ranges;
    private final String fallbackPeriod;

    public HolidayCalendar(List<HolidayRange> ranges, String fallbackPeriod) {
        this.ranges = List.copyOf(ranges);
        this.fallbackPeriod = fallbackPeriod;
    }

    public String classify(LocalDate date) {
        return classify(MonthDay.from(date));
    }

    public String classify(MonthDay day) {
        for (HolidayRange range : ranges) {
            if (range.contains(day)) {
                return range.getName();
            }
        }
        return fallbackPeriod;
    }

    public boolean isHolidaySeason(String period) {
        return !fallbackPeriod.equals(period);
    }

    /**
     * Every period this calendar can return, in priority order with the fallback last.
     */
    public List<String> periodNames() {
        List<String> names = new ArrayList<>();
        ranges.forEach(range -> names.add(range.getName()));
        if (!names.contains(fallbackPeriod)) {
            names.add(fallbackPeriod);
        }
        return List.copyOf(names);
    }
}
