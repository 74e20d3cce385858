package com.z254.insight.prism.source;

import java.util.List;
import java.util.Map;

/**
 * Supplies raw issue records to the pipeline.
 * <p>
 * Implementations own connectivity and any retry policy. Failures are reported as
 * {@link com.z254.insight.prism.error.IssueSourceException} and reach the caller of the
 * pipeline unchanged.
 */
public interface IssueSource {

    /**
     * @return raw records, each a map from source field name to value
     */
    List<Map<String, Object>> fetch();

    /**
     * Short description for logs.
     */
    String describe();
}
