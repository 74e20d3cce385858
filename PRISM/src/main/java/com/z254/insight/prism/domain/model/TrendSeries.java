package com.z254.insight.prism.domain.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.SortedSet;

/**
 * Month-by-month counts of one category together with its trend and anomaly annotations.
 */
@Value
@Builder
public class TrendSeries {

    @NonNull
    String category;

    /** Ordered by bucket */
    @Singular
    List<Point> points;

    @NonNull
    TrendLabel trendLabel;

    @Singular
    SortedSet<String> anomalousBuckets;

    /** Mean of the earlier half used for the trend label; 0 when the series is too short */
    double earlierMean;

    double laterMean;

    /** Least-squares slope in issues per bucket */
    double slope;

    public boolean isAnomalous(String bucket) {
        return anomalousBuckets.contains(bucket);
    }

    public int size() {
        return points.size();
    }

    @Value
    public static class Point {
        String bucket;
        int count;
    }
}
