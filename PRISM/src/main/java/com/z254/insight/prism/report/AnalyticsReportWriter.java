package com.z254.insight.prism.report;

import com.z254.insight.prism.domain.model.PipelineResult;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Renders a pipeline result. Writers only read the result.
 */
public interface AnalyticsReportWriter {

    void write(PipelineResult result, OutputStream out) throws IOException;
}
