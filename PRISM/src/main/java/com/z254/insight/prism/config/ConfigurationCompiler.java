package com.z254.insight.prism.config;

import com.z254.insight.prism.aggregate.BucketDimension;
import com.z254.insight.prism.aggregate.CategoryDimension;
import com.z254.insight.prism.aggregate.TableSpec;
import com.z254.insight.prism.domain.model.ExtractionConfidence;
import com.z254.insight.prism.error.ConfigurationException;
import com.z254.insight.prism.extract.CustomerNameFilter;
import com.z254.insight.prism.extract.CustomerRule;
import com.z254.insight.prism.extract.CustomerRuleType;
import com.z254.insight.prism.extract.PatternRule;
import com.z254.insight.prism.normalize.CanonicalField;
import com.z254.insight.prism.temporal.HolidayCalendar;
import com.z254.insight.prism.temporal.HolidayRange;
import com.z254.insight.prism.trend.TrendSettings;
import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.MonthDay;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Turns bound {@link PrismProperties} into a {@link PipelineConfiguration}, collecting
 * every problem before failing.
 */
@Slf4j
class ConfigurationCompiler {

    private final PrismProperties properties;
    private final List<String> problems = new ArrayList<>();

    ConfigurationCompiler(PrismProperties properties) {
        this.properties = properties;
    }

    PipelineConfiguration compile() {
        PrismProperties.Pipeline pipeline = properties.getPipeline();

        Map<CanonicalField, List<String>> aliases = compileFieldAliases();
        List<String> dateFormats = compileDateFormats();
        ZoneId zone = compileZone(pipeline.getZone());
        List<PatternRule> appRules = compileAppRules();
        List<CustomerRule> customerRules = compileCustomerRules(appRules);
        List<PatternRule> rootCauseRules = compileRootCauseRules();
        HolidayCalendar calendar = compileHolidayCalendar();
        TrendSettings trendSettings = compileTrendSettings();
        List<TableSpec> tables = compileTables(pipeline.getTables());

        if (pipeline.getMaxRecords() <= 0) {
            problems.add("pipeline.max-records must be positive, was " + pipeline.getMaxRecords());
        }
        if (pipeline.getMaxMonthSpan() <= 0) {
            problems.add("pipeline.max-month-span must be positive, was " + pipeline.getMaxMonthSpan());
        }
        if (pipeline.getTopN() <= 0) {
            problems.add("pipeline.top-n must be positive, was " + pipeline.getTopN());
        }
        if (pipeline.getStartDate() != null && pipeline.getEndDate() != null
                && pipeline.getStartDate().isAfter(pipeline.getEndDate())) {
            problems.add("pipeline.start-date " + pipeline.getStartDate() + " is after end-date " + pipeline.getEndDate());
        }

        if (!problems.isEmpty()) {
            log.error("Rejecting PRISM configuration: {} problem(s)", problems.size());
            throw new ConfigurationException(problems);
        }

        String projectKey = pipeline.getProjectKey();
        return PipelineConfiguration.builder()
                .fieldAliases(aliases)
                .dateFormats(dateFormats)
                .zone(zone)
                .appRules(appRules)
                .customerRules(customerRules)
                .rootCauseRules(rootCauseRules)
                .holidayCalendar(calendar)
                .trendSettings(trendSettings)
                .maxRecords(pipeline.getMaxRecords())
                .maxMonthSpan(pipeline.getMaxMonthSpan())
                .parallel(pipeline.isParallel())
                .topN(pipeline.getTopN())
                .startDate(pipeline.getStartDate())
                .endDate(pipeline.getEndDate())
                .projectKey(projectKey == null || projectKey.isBlank() ? null : projectKey.trim())
                .tables(tables)
                .build();
    }

    private Map<CanonicalField, List<String>> compileFieldAliases() {
        Map<CanonicalField, List<String>> compiled = new EnumMap<>(CanonicalField.class);
        Map<String, CanonicalField> owners = new HashMap<>();
        Map<String, List<String>> configured = properties.getNormalization().getFieldAliases();
        if (configured == null) {
            configured = Map.of();
        }

        configured.forEach((key, names) -> {
            Optional<CanonicalField> field = CanonicalField.fromKey(key);
            if (field.isEmpty()) {
                problems.add("normalization.field-aliases: unknown canonical field '" + key + "'");
                return;
            }
            List<String> cleaned = new ArrayList<>();
            for (String name : names == null ? List.<String>of() : names) {
                if (name == null || name.isBlank()) {
                    problems.add("normalization.field-aliases." + key + " contains a blank alias");
                    continue;
                }
                CanonicalField previous = owners.putIfAbsent(name.trim().toLowerCase(Locale.ROOT), field.get());
                if (previous != null && previous != field.get()) {
                    problems.add("normalization.field-aliases: alias '" + name + "' is mapped to both "
                            + previous.getKey() + " and " + field.get().getKey());
                }
                cleaned.add(name.trim());
            }
            compiled.put(field.get(), List.copyOf(cleaned));
        });

        for (CanonicalField field : CanonicalField.values()) {
            if (field.isRequired() && compiled.getOrDefault(field, List.of()).isEmpty()) {
                problems.add("normalization.field-aliases: required field '" + field.getKey() + "' has no alias");
            }
        }
        return Collections.unmodifiableMap(compiled);
    }

    private List<String> compileDateFormats() {
        List<String> formats = properties.getNormalization().getDateFormats();
        if (formats == null || formats.isEmpty()) {
            problems.add("normalization.date-formats must not be empty");
            return List.of();
        }
        for (String format : formats) {
            try {
                DateTimeFormatter.ofPattern(format, Locale.ENGLISH);
            } catch (IllegalArgumentException e) {
                problems.add("normalization.date-formats: invalid pattern '" + format + "': " + e.getMessage());
            }
        }
        return List.copyOf(formats);
    }

    private ZoneId compileZone(String zone) {
        if (zone == null || zone.isBlank()) {
            problems.add("pipeline.zone must be set");
            return ZoneId.of("UTC");
        }
        try {
            return ZoneId.of(zone.trim());
        } catch (DateTimeException e) {
            problems.add("pipeline.zone: unknown zone '" + zone + "'");
            return ZoneId.of("UTC");
        }
    }

    private List<PatternRule> compileAppRules() {
        List<PrismProperties.AppPattern> patterns = properties.getExtraction().getAppPatterns();
        if (patterns == null || patterns.isEmpty()) {
            problems.add("extraction.app-patterns must not be empty");
            return List.of();
        }
        List<PatternRule> rules = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (PrismProperties.AppPattern pattern : patterns) {
            if (pattern.getName() == null || pattern.getName().isBlank()) {
                problems.add("extraction.app-patterns: entry without a name");
                continue;
            }
            String name = pattern.getName().trim();
            if (!names.add(name.toLowerCase(Locale.ROOT))) {
                problems.add("extraction.app-patterns: duplicate app '" + name + "'");
                continue;
            }
            try {
                rules.add(pattern.getPattern() == null || pattern.getPattern().isBlank()
                        ? PatternRule.forName(name, ExtractionConfidence.HIGH)
                        : PatternRule.forRegex(name, ExtractionConfidence.HIGH, pattern.getPattern()));
            } catch (PatternSyntaxException e) {
                problems.add("extraction.app-patterns: invalid pattern for '" + name + "': " + e.getDescription());
            }
        }
        return List.copyOf(rules);
    }

    private List<CustomerRule> compileCustomerRules(List<PatternRule> appRules) {
        PrismProperties.Extraction extraction = properties.getExtraction();
        List<PrismProperties.CustomerPattern> patterns = extraction.getCustomerPatterns();
        if (patterns == null || patterns.isEmpty()) {
            problems.add("extraction.customer-patterns must not be empty");
            return List.of();
        }

        List<Pattern> appPatterns = new ArrayList<>();
        appRules.forEach(rule -> appPatterns.add(rule.getPattern()));
        CustomerNameFilter filter = new CustomerNameFilter(
                nonNull(extraction.getCustomerStopValues()),
                nonNull(extraction.getCustomerExcludedTerms()),
                appPatterns);

        List<CustomerRule> rules = new ArrayList<>();
        ExtractionConfidence previous = ExtractionConfidence.HIGH;
        for (PrismProperties.CustomerPattern pattern : patterns) {
            String name = pattern.getName() == null ? "<unnamed>" : pattern.getName();
            ExtractionConfidence confidence = parseEnum(ExtractionConfidence.class, pattern.getConfidence(),
                    "extraction.customer-patterns." + name + ".confidence");
            CustomerRuleType type = parseEnum(CustomerRuleType.class, pattern.getType(),
                    "extraction.customer-patterns." + name + ".type");
            if (confidence == null || type == null) {
                continue;
            }
            if (confidence == ExtractionConfidence.NONE) {
                problems.add("extraction.customer-patterns." + name + ": confidence NONE is reserved for no match");
                continue;
            }
            if (confidence.ordinal() < previous.ordinal()) {
                problems.add("extraction.customer-patterns must be ordered by decreasing confidence: '"
                        + name + "' (" + confidence + ") follows a " + previous + " rule");
            }
            previous = confidence;

            List<String> terms = nonNull(pattern.getTerms());
            try {
                switch (type) {
                    case MARKER, TRIGGER -> {
                        if (terms.isEmpty()) {
                            problems.add("extraction.customer-patterns." + name + ": " + type + " rules need terms");
                        } else if (type == CustomerRuleType.MARKER) {
                            rules.add(CustomerRule.marker(name, confidence, terms, filter));
                        } else {
                            rules.add(CustomerRule.trigger(name, confidence, terms, filter));
                        }
                    }
                    case CAPITALIZED_TOKEN -> rules.add(CustomerRule.capitalizedToken(name, confidence, filter));
                    case REGEX -> {
                        if (pattern.getRegex() == null || pattern.getRegex().isBlank()) {
                            problems.add("extraction.customer-patterns." + name + ": REGEX rules need a regex");
                        } else {
                            rules.add(CustomerRule.regex(name, confidence, pattern.getRegex(), filter));
                        }
                    }
                }
            } catch (IllegalArgumentException e) {
                problems.add("extraction.customer-patterns." + name + ": " + e.getMessage());
            }
        }
        return List.copyOf(rules);
    }

    private List<PatternRule> compileRootCauseRules() {
        List<PrismProperties.KeywordRule> configured = properties.getExtraction().getRootCauseRules();
        if (configured == null || configured.isEmpty()) {
            problems.add("extraction.root-cause-rules must not be empty");
            return List.of();
        }
        List<PatternRule> rules = new ArrayList<>();
        for (PrismProperties.KeywordRule rule : configured) {
            if (rule.getName() == null || rule.getName().isBlank()) {
                problems.add("extraction.root-cause-rules: entry without a name");
                continue;
            }
            List<String> keywords = nonNull(rule.getKeywords()).stream().filter(k -> k != null && !k.isBlank()).toList();
            if (keywords.isEmpty()) {
                problems.add("extraction.root-cause-rules." + rule.getName() + " has no keywords");
                continue;
            }
            rules.add(PatternRule.forKeywords(rule.getName().trim(), ExtractionConfidence.HIGH, keywords));
        }
        return List.copyOf(rules);
    }

    private HolidayCalendar compileHolidayCalendar() {
        PrismProperties.Holiday holiday = properties.getHoliday();
        String fallback = holiday.getFallbackPeriod();
        if (fallback == null || fallback.isBlank()) {
            problems.add("holiday.fallback-period must not be blank");
            fallback = "Off-Season";
        }
        fallback = fallback.trim();
        List<PrismProperties.HolidayRange> configured = nonNull(holiday.getRanges());
        if (configured.isEmpty()) {
            problems.add("holiday.ranges must not be empty");
        }

        List<HolidayRange> ranges = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (PrismProperties.HolidayRange range : configured) {
            if (range.getName() == null || range.getName().isBlank()) {
                problems.add("holiday.ranges: entry without a name");
                continue;
            }
            String name = range.getName().trim();
            if (!names.add(name) || name.equals(fallback)) {
                problems.add("holiday.ranges: period name '" + name + "' is used twice");
                continue;
            }
            MonthDay start = parseMonthDay(range.getStart(), "holiday.ranges." + name + ".start");
            MonthDay end = parseMonthDay(range.getEnd(), "holiday.ranges." + name + ".end");
            if (start != null && end != null) {
                ranges.add(new HolidayRange(name, start, end));
            }
        }
        return new HolidayCalendar(ranges, fallback);
    }

    private TrendSettings compileTrendSettings() {
        PrismProperties.Trend trend = properties.getTrend();
        PrismProperties.Anomaly anomaly = properties.getAnomaly();
        if (trend.getThreshold() < 0 || trend.getThreshold() >= 1) {
            problems.add("trend.threshold must be in [0, 1), was " + trend.getThreshold());
        }
        if (trend.getMinPoints() < 2) {
            problems.add("trend.min-points must be at least 2, was " + trend.getMinPoints());
        }
        if (anomaly.getWindow() < 1) {
            problems.add("anomaly.window must be at least 1, was " + anomaly.getWindow());
        }
        if (anomaly.getSensitivity() < 0) {
            problems.add("anomaly.sensitivity must not be negative, was " + anomaly.getSensitivity());
        }
        if (anomaly.getMinRelativeDeviation() < 0) {
            problems.add("anomaly.min-relative-deviation must not be negative, was " + anomaly.getMinRelativeDeviation());
        }
        if (anomaly.getMinHistory() < 1) {
            problems.add("anomaly.min-history must be at least 1, was " + anomaly.getMinHistory());
        }
        return TrendSettings.builder()
                .threshold(trend.getThreshold())
                .minPoints(trend.getMinPoints())
                .anomalyWindow(anomaly.getWindow())
                .anomalySensitivity(anomaly.getSensitivity())
                .anomalyMinRelativeDeviation(anomaly.getMinRelativeDeviation())
                .anomalyMinHistory(anomaly.getMinHistory())
                .build();
    }

    private List<TableSpec> compileTables(List<PrismProperties.TableRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            problems.add("pipeline.tables must not be empty");
            return List.of();
        }
        List<TableSpec> tables = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (PrismProperties.TableRequest request : requests) {
            CategoryDimension category = parseEnum(CategoryDimension.class, request.getCategory(), "pipeline.tables.category");
            BucketDimension bucket = parseEnum(BucketDimension.class, request.getBucket(), "pipeline.tables.bucket");
            if (category == null || bucket == null) {
                continue;
            }
            TableSpec spec = new TableSpec(category, bucket);
            if (!names.add(spec.getName())) {
                problems.add("pipeline.tables: table " + spec.getName() + " requested twice");
                continue;
            }
            tables.add(spec);
        }
        return List.copyOf(tables);
    }

    private MonthDay parseMonthDay(String value, String property) {
        if (value == null || value.isBlank()) {
            problems.add(property + " must be set (MM-dd)");
            return null;
        }
        try {
            return MonthDay.parse("--" + value.trim());
        } catch (DateTimeParseException e) {
            problems.add(property + ": '" + value + "' is not a MM-dd month/day");
            return null;
        }
    }

    private <E extends Enum<E>> E parseEnum(Class<E> type, String value, String property) {
        if (value == null || value.isBlank()) {
            problems.add(property + " must be set, one of " + Arrays.toString(type.getEnumConstants()));
            return null;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            problems.add(property + ": '" + value + "' is not one of " + Arrays.toString(type.getEnumConstants()));
            return null;
        }
    }

    private static <T> List<T> nonNull(List<T> values) {
        return values == null ? List.of() : values;
    }
}
