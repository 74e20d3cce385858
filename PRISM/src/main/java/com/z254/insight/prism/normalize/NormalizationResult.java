package com.z254.insight.prism.normalize;

import com.z254.insight.prism.domain.model.Issue;
import com.z254.insight.prism.domain.model.NormalizationReport;
import lombok.Value;

import java.util.List;

/**
 * Issues in input order plus the report of what was rejected.
 */
@Value
public class NormalizationResult {

    List<Issue> issues;

    NormalizationReport report;
}
