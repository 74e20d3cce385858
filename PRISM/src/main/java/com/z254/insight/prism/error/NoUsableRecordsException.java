package com.z254.insight.prism.error;

import com.z254.insight.prism.domain.model.NormalizationReport;

/**
 * Systemic failure: nothing survived normalization and scoping, so no table can be built.
 */
public class NoUsableRecordsException extends PrismException {

    private final NormalizationReport report;

    public NoUsableRecordsException(NormalizationReport report) {
        super("No usable records after normalization: received=" + report.getRecordsReceived()
                + ", rejected=" + report.getFailures().size()
                + ", outOfScope=" + report.getRecordsOutOfScope());
        this.report = report;
    }

    public NormalizationReport getReport() {
        return report;
    }
}
