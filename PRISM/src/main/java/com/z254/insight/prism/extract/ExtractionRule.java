package com.z254.insight.prism.extract;

import com.z254.insight.prism.domain.model.ExtractionConfidence;

import java.util.Optional;

/**
 * One entry of an ordered rule list. Rules are stateless and safe to share across threads.
 */
public interface ExtractionRule {

    String getName();

    ExtractionConfidence getConfidence();

    /**
     * @return the extracted value for the first acceptable occurrence in reading order
     */
    Optional<String> apply(String text);
}
