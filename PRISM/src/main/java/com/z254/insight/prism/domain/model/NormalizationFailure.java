package com.z254.insight.prism.domain.model;

import lombok.Value;

/**
 * A raw record that could not become an {@link Issue}.
 */
@Value
public class NormalizationFailure {

    /** Zero-based position of the record in the input batch */
    int recordIndex;

    /** Source id when one could be read, otherwise null */
    String recordId;

    String reason;
}
