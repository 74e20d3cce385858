package com.z254.insight.prism.aggregate;

import com.z254.insight.prism.domain.model.*;
import com.z254.insight.prism.temporal.HolidayCalendar;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Volume and resolution summaries: overall, per month, per category and holiday season
 * against off-season.
 */
public class SummaryCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final HolidayCalendar calendar;

    public SummaryCalculator(HolidayCalendar calendar) {
        this.calendar = calendar;
    }

    /**
     * @param tables built tables; each distinct category dimension gets one per-category
     *               breakdown in the ranking order of the first table using it
     */
    public AnalyticsSummary summarize(List<EnrichedIssue> issues, Collection<AggregationTable> tables) {
        Map<String, List<EnrichedIssue>> byMonth = issues.stream()
                .collect(Collectors.groupingBy(EnrichedIssue::getMonthBucket));
        List<ResolutionSummary> monthly = new ArrayList<>();
        for (String month : IssueAggregator.monthRange(issues)) {
            monthly.add(summarize(month, byMonth.getOrDefault(month, List.of())));
        }

        Map<String, List<ResolutionSummary>> byCategory = new LinkedHashMap<>();
        for (AggregationTable table : tables) {
            if (byCategory.containsKey(table.getCategoryDimension())) {
                continue;
            }
            CategoryDimension dimension = dimension(table.getCategoryDimension());
            Map<String, List<EnrichedIssue>> groups = issues.stream()
                    .collect(Collectors.groupingBy(dimension::select));
            List<ResolutionSummary> rows = new ArrayList<>();
            for (String category : table.getCategories()) {
                rows.add(summarize(category, groups.getOrDefault(category, List.of())));
            }
            byCategory.put(table.getCategoryDimension(), List.copyOf(rows));
        }

        return AnalyticsSummary.builder()
                .overall(summarize("overall", issues, issue -> true))
                .monthly(List.copyOf(monthly))
                .byCategory(Collections.unmodifiableMap(byCategory))
                .holidaySeason(holidaySeason(issues))
                .build();
    }

    public HolidaySeasonSummary holidaySeason(List<EnrichedIssue> issues) {
        Map<String, Integer> periodCounts = new LinkedHashMap<>();
        calendar.periodNames().forEach(period -> periodCounts.put(period, 0));
        issues.forEach(issue -> periodCounts.merge(issue.getHolidayPeriod(), 1, Integer::sum));

        int holiday = (int) issues.stream().filter(EnrichedIssue::isHolidaySeason).count();
        return HolidaySeasonSummary.builder()
                .holidaySeasonIssues(holiday)
                .offSeasonIssues(issues.size() - holiday)
                .holidaySeasonPercentage(percentage(holiday, issues.size()))
                .periodCounts(Collections.unmodifiableMap(periodCounts))
                .holidaySeason(summarize("holiday season", issues, EnrichedIssue::isHolidaySeason))
                .offSeason(summarize(calendar.getFallbackPeriod(), issues, issue -> !issue.isHolidaySeason()))
                .build();
    }

    public ResolutionSummary summarize(String label, List<EnrichedIssue> issues, Predicate<EnrichedIssue> filter) {
        return summarize(label, issues.stream().filter(filter).toList());
    }

    private ResolutionSummary summarize(String label, List<EnrichedIssue> group) {
        List<Double> days = new ArrayList<>();
        for (EnrichedIssue issue : group) {
            issue.resolutionDays().ifPresent(days::add);
        }
        int total = group.size();
        return ResolutionSummary.builder()
                .label(label)
                .totalIssues(total)
                .resolvedIssues(days.size())
                .resolutionRate(percentage(days.size(), total))
                .averageResolutionDays(average(days))
                .medianResolutionDays(median(days))
                .build();
    }

    static BigDecimal percentage(int part, int whole) {
        if (whole == 0) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_EVEN);
        }
        return BigDecimal.valueOf(part)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(whole), 2, RoundingMode.HALF_EVEN);
    }

    private static BigDecimal average(List<Double> values) {
        if (values.isEmpty()) {
            return null;
        }
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return scaled(sum / values.size());
    }

    private static BigDecimal median(List<Double> values) {
        if (values.isEmpty()) {
            return null;
        }
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int middle = sorted.size() / 2;
        double median = sorted.size() % 2 == 1
                ? sorted.get(middle)
                : (sorted.get(middle - 1) + sorted.get(middle)) / 2;
        return scaled(median);
    }

    private static BigDecimal scaled(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_EVEN);
    }

    private static CategoryDimension dimension(String key) {
        for (CategoryDimension dimension : CategoryDimension.values()) {
            if (dimension.getKey().equals(key)) {
                return dimension;
            }
        }
        throw new IllegalArgumentException("Unknown category dimension: " + key);
    }
}
