package com.z254.insight.prism.temporal;

import lombok.NonNull;
import lombok.Value;

import java.time.MonthDay;

/**
 * A named month/day range, both ends inclusive and independent of the year.
 * <p>
 * When {@code end} precedes {@code start} the range crosses the year boundary: it covers
 * {@code start} through December 31 of year Y and January 1 through {@code end} of Y+1.
 */
@Value
public class HolidayRange {

    @NonNull
    String name;

    @NonNull
    MonthDay start;

    @NonNull
    MonthDay end;

    public boolean crossesYearBoundary() {
        return end.isBefore(start);
    }

    public boolean contains(MonthDay day) {
        if (crossesYearBoundary()) {
            return !day.isBefore(start) || !day.isAfter(end);
        }
        return !day.isBefore(start) && !day.isAfter(end);
    }
}
