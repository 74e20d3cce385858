package com.z254.insight.prism.trend;

import com.z254.insight.prism.domain.model.AggregationTable;
import com.z254.insight.prism.domain.model.TrendLabel;
import com.z254.insight.prism.domain.model.TrendSeries;

import java.util.ArrayList;
import java.util.List;

/**
 * Labels monthly series as increasing, decreasing or stable and flags anomalous months.
 * <p>
 * Trend: the mean of the later half of the series against the mean of the earlier half
 * ({@code floor(n/2)} points each). Anomaly: a point with enough history whose distance
 * from the trailing-window mean exceeds both {@code sensitivity} standard deviations and
 * {@code minRelativeDeviation} times the window mean (floored at 1).
 */
public class TrendDetector {

    private final TrendSettings settings;

    public TrendDetector(TrendSettings settings) {
        this.settings = settings;
    }

    /**
     * One series per category row, in the table's ranking order.
     */
    public List<TrendSeries> detectAll(AggregationTable table) {
        List<TrendSeries> series = new ArrayList<>();
        for (String category : table.getCategories()) {
            List<TrendSeries.Point> points = new ArrayList<>();
            for (String bucket : table.getBuckets()) {
                points.add(new TrendSeries.Point(bucket, table.count(category, bucket)));
            }
            series.add(detect(category, points));
        }
        return series;
    }

    public TrendSeries detect(String category, List<TrendSeries.Point> points) {
        int[] counts = points.stream().mapToInt(TrendSeries.Point::getCount).toArray();
        TrendSeries.TrendSeriesBuilder series = TrendSeries.builder()
                .category(category)
                .points(points)
                .slope(slope(counts));

        if (counts.length < settings.getMinPoints()) {
            series.trendLabel(TrendLabel.STABLE);
        } else {
            int half = counts.length / 2;
            double earlier = mean(counts, 0, half);
            double later = mean(counts, counts.length - half, counts.length);
            series.earlierMean(earlier)
                    .laterMean(later)
                    .trendLabel(label(earlier, later));
        }

        for (int i = 0; i < counts.length; i++) {
            if (isAnomalous(counts, i)) {
                series.anomalousBucket(points.get(i).getBucket());
            }
        }
        return series.build();
    }

    TrendLabel label(double earlierMean, double laterMean) {
        if (earlierMean == 0) {
            return laterMean > 0 ? TrendLabel.INCREASING : TrendLabel.STABLE;
        }
        if (laterMean > earlierMean * (1 + settings.getThreshold())) {
            return TrendLabel.INCREASING;
        }
        if (laterMean < earlierMean * (1 - settings.getThreshold())) {
            return TrendLabel.DECREASING;
        }
        return TrendLabel.STABLE;
    }

    boolean isAnomalous(int[] counts, int index) {
        if (index < settings.getAnomalyMinHistory()) {
            return false;
        }
        int from = Math.max(0, index - settings.getAnomalyWindow());
        double mean = mean(counts, from, index);
        double deviation = Math.abs(counts[index] - mean);
        double sigma = standardDeviation(counts, from, index, mean);
        return deviation > settings.getAnomalySensitivity() * sigma
                && deviation > settings.getAnomalyMinRelativeDeviation() * Math.max(mean, 1.0);
    }

    static double slope(int[] counts) {
        int n = counts.length;
        if (n < 2) {
            return 0.0;
        }
        double meanX = (n - 1) / 2.0;
        double meanY = mean(counts, 0, n);
        double numerator = 0;
        double denominator = 0;
        for (int x = 0; x < n; x++) {
            numerator += (x - meanX) * (counts[x] - meanY);
            denominator += (x - meanX) * (x - meanX);
        }
        return numerator / denominator;
    }

    private static double mean(int[] counts, int from, int to) {
        if (to <= from) {
            return 0.0;
        }
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += counts[i];
        }
        return sum / (to - from);
    }

    // population standard deviation
    private static double standardDeviation(int[] counts, int from, int to, double mean) {
        double squares = 0;
        for (int i = from; i < to; i++) {
            squares += (counts[i] - mean) * (counts[i] - mean);
        }
        return Math.sqrt(squares / (to - from));
    }
}
