package com.z254.insight.prism.aggregate;

import com.z254.insight.prism.domain.model.AggregationTable;
import com.z254.insight.prism.domain.model.EnrichedIssue;
import com.z254.insight.prism.temporal.HolidayCalendar;

import java.time.YearMonth;
import java.util.*;
import java.util.function.Function;

/**
 * Builds pivot tables of issue counts per (category, bucket).
 * <p>
 * Every issue lands in exactly one cell: blank category values are counted under
 * {@link EnrichedIssue#UNKNOWN}, so the grand total always equals the number of issues.
 */
public class IssueAggregator {

    private final HolidayCalendar calendar;

    public IssueAggregator(HolidayCalendar calendar) {
        this.calendar = calendar;
    }

    public AggregationTable aggregate(TableSpec spec, List<EnrichedIssue> issues) {
        return aggregate(spec.getName(),
                spec.getCategory().getKey(),
                spec.getBucket().getKey(),
                issues,
                spec.getCategory()::select,
                spec.getBucket()::select,
                bucketAxis(spec.getBucket(), issues));
    }

    /**
     * @param declaredBuckets columns that appear even when empty, in this order; buckets
     *                        observed outside this list are appended in natural order
     */
    public AggregationTable aggregate(String name,
                                      String categoryDimension,
                                      String bucketDimension,
                                      List<EnrichedIssue> issues,
                                      Function<EnrichedIssue, String> categorySelector,
                                      Function<EnrichedIssue, String> bucketSelector,
                                      List<String> declaredBuckets) {
        Map<String, Map<String, Integer>> counts = new HashMap<>();
        SortedSet<String> undeclared = new TreeSet<>();
        Set<String> declared = new HashSet<>(declaredBuckets);

        for (EnrichedIssue issue : issues) {
            String category = orUnknown(categorySelector.apply(issue));
            String bucket = orUnknown(bucketSelector.apply(issue));
            counts.computeIfAbsent(category, c -> new HashMap<>()).merge(bucket, 1, Integer::sum);
            if (!declared.contains(bucket)) {
                undeclared.add(bucket);
            }
        }

        List<String> buckets = new ArrayList<>(declaredBuckets);
        buckets.addAll(undeclared);
        return AggregationTable.of(name, categoryDimension, bucketDimension, buckets, counts);
    }

    /**
     * Column axis for a bucket dimension: the gap-free month range, the observed quarters,
     * or every holiday period in calendar order.
     */
    public List<String> bucketAxis(BucketDimension dimension, List<EnrichedIssue> issues) {
        return switch (dimension) {
            case MONTH -> monthRange(issues);
            case QUARTER -> issues.stream().map(EnrichedIssue::getQuarterBucket).distinct().sorted().toList();
            case HOLIDAY_PERIOD -> calendar.periodNames();
        };
    }

    public static List<String> monthRange(List<EnrichedIssue> issues) {
        Optional<YearMonth> first = issues.stream().map(EnrichedIssue::getMonthYear).min(Comparator.naturalOrder());
        Optional<YearMonth> last = issues.stream().map(EnrichedIssue::getMonthYear).max(Comparator.naturalOrder());
        if (first.isEmpty()) {
            return List.of();
        }
        List<String> months = new ArrayList<>();
        for (YearMonth month = first.get(); !month.isAfter(last.get()); month = month.plusMonths(1)) {
            months.add(month.toString());
        }
        return months;
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? EnrichedIssue.UNKNOWN : value.trim();
    }
}
