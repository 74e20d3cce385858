package com.z254.insight.prism.trend;

import lombok.Builder;
import lombok.Value;

/**
 * Thresholds of the trend label and the anomaly rule.
 */
@Value
@Builder(toBuilder = true)
public class TrendSettings {

    @Builder.Default
    double threshold = 0.15;

    @Builder.Default
    int minPoints = 2;

    @Builder.Default
    int anomalyWindow = 3;

    @Builder.Default
    double anomalySensitivity = 3.0;

    @Builder.Default
    double anomalyMinRelativeDeviation = 0.5;

    @Builder.Default
    int anomalyMinHistory = 2;
}
