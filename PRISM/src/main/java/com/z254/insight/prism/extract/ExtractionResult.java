package com.z254.insight.prism.extract;

import com.z254.insight.prism.domain.model.EnrichedIssue;
import com.z254.insight.prism.domain.model.ExtractionConfidence;
import lombok.Value;

/**
 * Value recovered by a {@link RuleChain}, with the rule that produced it.
 */
@Value
public class ExtractionResult {

    private static final ExtractionResult UNKNOWN =
            new ExtractionResult(EnrichedIssue.UNKNOWN, ExtractionConfidence.NONE, null);

    String value;

    ExtractionConfidence confidence;

    /** Null when nothing matched */
    String ruleName;

    public static ExtractionResult unknown() {
        return UNKNOWN;
    }

    public boolean isKnown() {
        return confidence != ExtractionConfidence.NONE;
    }
}
