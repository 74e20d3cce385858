package com.z254.insight.prism.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Outcome of normalizing one input batch: what was kept, what was rejected and why.
 */
@Value
@Builder(toBuilder = true)
public class NormalizationReport {

    int recordsReceived;

    int recordsNormalized;

    /** Normalized issues left out by the analysis window or project filter */
    int recordsOutOfScope;

    @Singular
    List<NormalizationFailure> failures;

    /** Field-level problems that did not cost the record (unparseable optional dates, ...) */
    @Singular
    List<String> warnings;

    public int getRecordsUsable() {
        return recordsNormalized - recordsOutOfScope;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * Failure count per reason, sorted by reason.
     */
    public Map<String, Long> getFailureCountsByReason() {
        return failures.stream()
                .collect(Collectors.groupingBy(NormalizationFailure::getReason, TreeMap::new, Collectors.counting()));
    }
}
