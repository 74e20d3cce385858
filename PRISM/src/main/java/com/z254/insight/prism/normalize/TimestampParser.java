package com.z254.insight.prism.normalize;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses the timestamp shapes issue trackers export.
 * <p>
 * ISO-8601 with an offset is tried first, then ISO local date-time, then the configured
 * patterns in order. Values without an offset are taken in the configured zone; date-only
 * values map to the start of that day.
 */
public class TimestampParser {

    private final List<DateTimeFormatter> formatters;
    private final ZoneId zone;

    public TimestampParser(List<String> patterns, ZoneId zone) {
        this.zone = zone;
        List<DateTimeFormatter> compiled = new ArrayList<>();
        compiled.add(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        compiled.add(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        for (String pattern : patterns) {
            compiled.add(new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendPattern(pattern)
                    .toFormatter(Locale.ENGLISH));
        }
        this.formatters = List.copyOf(compiled);
    }

    public ZoneId getZone() {
        return zone;
    }

    /**
     * @return empty for null or blank input
     * @throws DateTimeParseException when the value is present but matches no known form
     */
    public Optional<Instant> parse(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Instant instant) {
            return Optional.of(instant);
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return Optional.of(offsetDateTime.toInstant());
        }
        if (value instanceof ZonedDateTime zonedDateTime) {
            return Optional.of(zonedDateTime.toInstant());
        }
        if (value instanceof LocalDateTime localDateTime) {
            return Optional.of(localDateTime.atZone(zone).toInstant());
        }
        if (value instanceof LocalDate localDate) {
            return Optional.of(localDate.atStartOfDay(zone).toInstant());
        }
        if (value instanceof Date date) {
            return Optional.of(date.toInstant());
        }
        if (value instanceof Number epochMillis) {
            return Optional.of(Instant.ofEpochMilli(epochMillis.longValue()));
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(parseText(text));
    }

    private Instant parseText(String text) {
        for (DateTimeFormatter formatter : formatters) {
            try {
                TemporalAccessor parsed = formatter.parseBest(text,
                        ZonedDateTime::from, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
                return toInstant(parsed);
            } catch (DateTimeParseException e) {
                // next format
            }
        }
        throw new DateTimeParseException("No accepted date format matches '" + text + "'", text, 0);
    }

    private Instant toInstant(TemporalAccessor parsed) {
        if (parsed instanceof ZonedDateTime zonedDateTime) {
            return zonedDateTime.toInstant();
        }
        if (parsed instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        if (parsed instanceof LocalDateTime localDateTime) {
            return localDateTime.atZone(zone).toInstant();
        }
        return ((LocalDate) parsed).atStartOfDay(zone).toInstant();
    }
}
