package com.z254.insight.prism.domain.model;

public enum TrendLabel {
    INCREASING,
    DECREASING,
    STABLE
}
