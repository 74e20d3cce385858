package com.z254.insight.prism.normalize;

import com.z254.insight.prism.error.PrismException;

/**
 * A single record cannot become an issue. Never leaves the normalizer: it is turned into a
 * {@link com.z254.insight.prism.domain.model.NormalizationFailure}.
 */
class RecordRejectedException extends PrismException {

    private final String reason;
    private final String recordId;

    RecordRejectedException(String reason, String recordId, String detail) {
        super(reason + (detail == null ? "" : ": " + detail));
        this.reason = reason;
        this.recordId = recordId;
    }

    String getReason() {
        return reason;
    }

    String getRecordId() {
        return recordId;
    }
}
