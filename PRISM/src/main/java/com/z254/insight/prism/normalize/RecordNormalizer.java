package com.z254.insight.prism.normalize;

import com.z254.insight.prism.domain.model.Issue;
import com.z254.insight.prism.domain.model.NormalizationFailure;
import com.z254.insight.prism.domain.model.NormalizationReport;
import com.z254.insight.prism.observability.PrismStructuredLogger;
import com.z254.insight.prism.observability.PrismStructuredLogger.RecordEventType;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Maps heterogeneous source records onto the canonical {@link Issue} schema.
 * <p>
 * Field names are matched case-insensitively against the alias table; for each canonical
 * field the first alias with a non-blank value wins. A record without an id or a usable
 * creation timestamp is rejected and reported, never fatal. Unparseable optional
 * timestamps are dropped with a warning. Unmatched source fields are kept in
 * {@link Issue#getRawFields()}.
 */
@Slf4j
public class RecordNormalizer {

    public static final String REASON_NULL_RECORD = "null record";
    public static final String REASON_MISSING_ID = "missing id";
    public static final String REASON_DUPLICATE_ID = "duplicate id";
    public static final String REASON_MISSING_CREATED = "missing created_at";
    public static final String REASON_UNPARSEABLE_CREATED = "unparseable created_at";
    public static final String REASON_CREATED_OUT_OF_SPAN = "created_at outside plausible span";

    private final Map<CanonicalField, List<String>> aliases;
    private final Map<String, CanonicalField> fieldByAlias;
    private final TimestampParser timestampParser;
    private final int maxMonthSpan;
    private final PrismStructuredLogger structuredLogger;

    /**
     * @param maxMonthSpan records created more than this many months before or after the
     *                     median creation month of the batch are rejected
     */
    public RecordNormalizer(Map<CanonicalField, List<String>> aliases,
                            TimestampParser timestampParser,
                            int maxMonthSpan,
                            PrismStructuredLogger structuredLogger) {
        this.aliases = aliases;
        this.timestampParser = timestampParser;
        this.maxMonthSpan = maxMonthSpan;
        this.structuredLogger = structuredLogger;
        Map<String, CanonicalField> byAlias = new HashMap<>();
        aliases.forEach((field, names) ->
                names.forEach(name -> byAlias.putIfAbsent(name.toLowerCase(Locale.ROOT), field)));
        this.fieldByAlias = Map.copyOf(byAlias);
    }

    /**
     * Normalize a batch. Records are independent, so {@code parallel} only changes
     * throughput; duplicate detection and the creation-span check run afterwards in input order.
     */
    public NormalizationResult normalize(List<? extends Map<String, ?>> records, boolean parallel) {
        IntStream indexes = IntStream.range(0, records.size());
        if (parallel) {
            indexes = indexes.parallel();
        }
        List<RecordOutcome> outcomes = indexes
                .mapToObj(index -> normalizeRecord(index, records.get(index)))
                .collect(Collectors.toList());

        NormalizationReport.NormalizationReportBuilder report = NormalizationReport.builder()
                .recordsReceived(records.size());
        List<RecordOutcome> unique = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();

        for (RecordOutcome outcome : outcomes) {
            outcome.warnings().forEach(report::warning);
            if (outcome.failure() != null) {
                reject(report, outcome.failure());
                continue;
            }
            Issue issue = outcome.issue();
            if (!seenIds.add(issue.getId())) {
                reject(report, new NormalizationFailure(outcome.index(), issue.getId(), REASON_DUPLICATE_ID));
                continue;
            }
            unique.add(outcome);
        }
        List<Issue> issues = withinMonthSpan(unique, report);

        NormalizationReport built = report.recordsNormalized(issues.size()).build();
        log.info("Normalized {} of {} records ({} rejected, {} warnings)",
                built.getRecordsNormalized(), built.getRecordsReceived(),
                built.getFailures().size(), built.getWarnings().size());
        return new NormalizationResult(List.copyOf(issues), built);
    }

    /**
     * Drops issues whose creation month lies too far from the batch median. A mistyped year
     * would otherwise stretch every gap-filled month axis.
     */
    private List<Issue> withinMonthSpan(List<RecordOutcome> outcomes,
                                        NormalizationReport.NormalizationReportBuilder report) {
        if (outcomes.isEmpty()) {
            return List.of();
        }
        List<YearMonth> months = outcomes.stream()
                .map(outcome -> creationMonth(outcome.issue()))
                .sorted()
                .toList();
        YearMonth median = months.get(months.size() / 2);

        List<Issue> issues = new ArrayList<>();
        for (RecordOutcome outcome : outcomes) {
            Issue issue = outcome.issue();
            if (Math.abs(ChronoUnit.MONTHS.between(median, creationMonth(issue))) > maxMonthSpan) {
                reject(report, new NormalizationFailure(outcome.index(), issue.getId(), REASON_CREATED_OUT_OF_SPAN));
                continue;
            }
            issues.add(issue);
        }
        return issues;
    }

    private YearMonth creationMonth(Issue issue) {
        return YearMonth.from(issue.getCreatedAt().atZone(timestampParser.getZone()));
    }

    private void reject(NormalizationReport.NormalizationReportBuilder report, NormalizationFailure failure) {
        report.failure(failure);
        structuredLogger.logRecordEvent(failure.getRecordIndex(), failure.getRecordId(),
                RecordEventType.REJECTED, "Record rejected: " + failure.getReason());
    }

    private RecordOutcome normalizeRecord(int index, Map<String, ?> record) {
        List<String> warnings = new ArrayList<>();
        try {
            return new RecordOutcome(index, toIssue(index, record, warnings), null, warnings);
        } catch (RecordRejectedException e) {
            log.debug("Record {} rejected: {}", index, e.getMessage());
            return new RecordOutcome(index, null,
                    new NormalizationFailure(index, e.getRecordId(), e.getReason()), warnings);
        }
    }

    private Issue toIssue(int index, Map<String, ?> record, List<String> warnings) {
        if (record == null) {
            throw new RecordRejectedException(REASON_NULL_RECORD, null, null);
        }
        Map<String, Object> byLowerName = new LinkedHashMap<>();
        record.forEach((name, value) -> {
            if (name != null) {
                byLowerName.putIfAbsent(name.trim().toLowerCase(Locale.ROOT), value);
            }
        });

        String id = text(byLowerName, CanonicalField.ID);
        if (id == null) {
            throw new RecordRejectedException(REASON_MISSING_ID, null, null);
        }

        Object createdValue = value(byLowerName, CanonicalField.CREATED_AT);
        Instant createdAt;
        try {
            createdAt = timestampParser.parse(createdValue)
                    .orElseThrow(() -> new RecordRejectedException(REASON_MISSING_CREATED, id, null));
        } catch (DateTimeParseException e) {
            throw new RecordRejectedException(REASON_UNPARSEABLE_CREATED, id, e.getMessage());
        }

        Instant updatedAt = optionalTimestamp(index, id, byLowerName, CanonicalField.UPDATED_AT, warnings);
        Instant resolvedAt = optionalTimestamp(index, id, byLowerName, CanonicalField.RESOLVED_AT, warnings);
        if (resolvedAt != null && resolvedAt.isBefore(createdAt)) {
            warn(index, id, warnings, "resolved_at " + resolvedAt + " precedes created_at " + createdAt + ", dropped");
            resolvedAt = null;
        }

        Issue.IssueBuilder issue = Issue.builder()
                .id(id)
                .summary(text(byLowerName, CanonicalField.SUMMARY))
                .description(text(byLowerName, CanonicalField.DESCRIPTION))
                .status(text(byLowerName, CanonicalField.STATUS))
                .priority(text(byLowerName, CanonicalField.PRIORITY))
                .issueType(text(byLowerName, CanonicalField.ISSUE_TYPE))
                .resolution(text(byLowerName, CanonicalField.RESOLUTION))
                .rootCause(text(byLowerName, CanonicalField.ROOT_CAUSE))
                .assignee(text(byLowerName, CanonicalField.ASSIGNEE))
                .reporter(text(byLowerName, CanonicalField.REPORTER))
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .resolvedAt(resolvedAt);

        record.forEach((name, value) -> {
            if (name != null && value != null && !fieldByAlias.containsKey(name.trim().toLowerCase(Locale.ROOT))) {
                issue.rawField(name, value);
            }
        });
        return issue.build();
    }

    private Instant optionalTimestamp(int index, String id, Map<String, Object> record,
                                      CanonicalField field, List<String> warnings) {
        Object value = value(record, field);
        try {
            return timestampParser.parse(value).orElse(null);
        } catch (DateTimeParseException e) {
            warn(index, id, warnings, "unparseable " + field.getKey().replace('-', '_') + " '" + value + "', dropped");
            return null;
        }
    }

    private void warn(int index, String id, List<String> warnings, String message) {
        warnings.add("record " + index + " (" + id + "): " + message);
        structuredLogger.logRecordEvent(index, id, RecordEventType.FIELD_DROPPED, message);
    }

    /**
     * First non-blank value among the field's aliases, in alias order.
     */
    private Object value(Map<String, Object> record, CanonicalField field) {
        for (String alias : aliases.getOrDefault(field, List.of())) {
            Object value = record.get(alias.toLowerCase(Locale.ROOT));
            if (value != null && !(value instanceof String s && s.isBlank())) {
                return value;
            }
        }
        return null;
    }

    private String text(Map<String, Object> record, CanonicalField field) {
        Object value = value(record, field);
        if (value == null) {
            return null;
        }
        String text = asText(value);
        return text == null || text.isBlank() ? null : text.trim();
    }

    /**
     * Tracker exports nest names in objects ({@code {"name": "High"}}) and keep labels in lists.
     */
    static String asText(Object value) {
        if (value instanceof Map<?, ?> map) {
            for (String key : List.of("name", "displayName", "value", "key")) {
                Object nested = map.get(key);
                if (nested != null) {
                    return asText(nested);
                }
            }
            return null;
        }
        if (value instanceof Collection<?> values) {
            return values.stream()
                    .map(RecordNormalizer::asText)
                    .filter(Objects::nonNull)
                    .collect(Collectors.joining(", "));
        }
        return value.toString();
    }

    private record RecordOutcome(int index, Issue issue, NormalizationFailure failure, List<String> warnings) {
    }
}
