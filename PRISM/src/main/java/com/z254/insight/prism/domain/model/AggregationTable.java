package com.z254.insight.prism.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;

/**
 * Issue counts per (category, bucket) with row and column totals.
 * <p>
 * Rows are kept in ranking order: total descending, then category name ascending. The
 * sum of all cells equals the number of issues that contributed to the table; issues
 * without a category value are counted under {@link EnrichedIssue#UNKNOWN}.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class AggregationTable {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final String name;
    private final String categoryDimension;
    private final String bucketDimension;
    private final List<String> categories;
    private final List<String> buckets;
    private final Map<String, Map<String, Integer>> cells;
    private final Map<String, Integer> rowTotals;
    private final Map<String, Integer> columnTotals;
    private final int grandTotal;

    private AggregationTable(String name,
                             String categoryDimension,
                             String bucketDimension,
                             List<String> buckets,
                             Map<String, Map<String, Integer>> counts) {
        this.name = name;
        this.categoryDimension = categoryDimension;
        this.bucketDimension = bucketDimension;
        this.buckets = List.copyOf(buckets);

        Map<String, Integer> totalsByCategory = new HashMap<>();
        counts.forEach((category, row) ->
                totalsByCategory.put(category, row.values().stream().mapToInt(Integer::intValue).sum()));

        List<String> ranked = new ArrayList<>(counts.keySet());
        ranked.sort(Comparator.<String>comparingInt(totalsByCategory::get).reversed()
                .thenComparing(Comparator.naturalOrder()));
        this.categories = List.copyOf(ranked);

        Map<String, Map<String, Integer>> orderedCells = new LinkedHashMap<>();
        Map<String, Integer> orderedRowTotals = new LinkedHashMap<>();
        Map<String, Integer> orderedColumnTotals = new LinkedHashMap<>();
        this.buckets.forEach(bucket -> orderedColumnTotals.put(bucket, 0));

        int total = 0;
        for (String category : ranked) {
            Map<String, Integer> source = counts.get(category);
            Map<String, Integer> row = new LinkedHashMap<>();
            for (String bucket : this.buckets) {
                int count = source.getOrDefault(bucket, 0);
                row.put(bucket, count);
                orderedColumnTotals.merge(bucket, count, Integer::sum);
            }
            orderedCells.put(category, Collections.unmodifiableMap(row));
            orderedRowTotals.put(category, totalsByCategory.get(category));
            total += totalsByCategory.get(category);
        }

        this.cells = Collections.unmodifiableMap(orderedCells);
        this.rowTotals = Collections.unmodifiableMap(orderedRowTotals);
        this.columnTotals = Collections.unmodifiableMap(orderedColumnTotals);
        this.grandTotal = total;
    }

    /**
     * Build a table from raw counts.
     *
     * @param buckets column order; every bucket used in {@code counts} must be listed
     * @param counts  category to (bucket to count)
     */
    public static AggregationTable of(String name,
                                      String categoryDimension,
                                      String bucketDimension,
                                      List<String> buckets,
                                      Map<String, Map<String, Integer>> counts) {
        Set<String> declared = new HashSet<>(buckets);
        counts.values().forEach(row -> row.keySet().forEach(bucket -> {
            if (!declared.contains(bucket)) {
                throw new IllegalArgumentException("Bucket '" + bucket + "' is not part of the column axis of " + name);
            }
        }));
        return new AggregationTable(name, categoryDimension, bucketDimension, buckets, counts);
    }

    public int count(String category, String bucket) {
        Map<String, Integer> row = cells.get(category);
        return row == null ? 0 : row.getOrDefault(bucket, 0);
    }

    public int rowTotal(String category) {
        return rowTotals.getOrDefault(category, 0);
    }

    /**
     * Counts of one category across the bucket axis, in column order.
     */
    public List<Integer> row(String category) {
        Map<String, Integer> row = cells.get(category);
        if (row == null) {
            return Collections.nCopies(buckets.size(), 0);
        }
        return List.copyOf(row.values());
    }

    /**
     * Share of the grand total held by one category, as a percentage.
     */
    public BigDecimal percentageOf(String category) {
        if (grandTotal == 0) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_EVEN);
        }
        return BigDecimal.valueOf(rowTotal(category))
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(grandTotal), 2, RoundingMode.HALF_EVEN);
    }

    /**
     * The first {@code limit} categories in ranking order.
     */
    public List<CategoryTotal> topCategories(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        List<CategoryTotal> top = new ArrayList<>();
        for (int i = 0; i < Math.min(limit, categories.size()); i++) {
            String category = categories.get(i);
            top.add(new CategoryTotal(i + 1, category, rowTotal(category), percentageOf(category)));
        }
        return top;
    }

    /**
     * Every category with its total and percentage, in ranking order.
     */
    public List<CategoryTotal> getDistribution() {
        return topCategories(categories.size());
    }
}
