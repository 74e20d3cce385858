package com.z254.insight.prism.domain.model;

/**
 * Qualitative grade attached to a heuristically extracted value.
 * Declared from strongest to weakest.
 */
public enum ExtractionConfidence {
    HIGH,
    MEDIUM,
    LOW,
    NONE
}
