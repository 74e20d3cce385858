package com.z254.insight.prism.domain.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.SortedMap;

/**
 * Canonical issue record produced by the normalizer.
 * <p>
 * Instances are immutable. {@code createdAt} is always present and never after
 * {@code resolvedAt}; an issue with {@code resolvedAt} set is considered resolved.
 */
@Value
@Builder(toBuilder = true)
public class Issue {

    /** Source key, unique within one run */
    @NonNull
    String id;

    String summary;

    String description;

    String status;

    String priority;

    String issueType;

    /** Resolution type as reported by the tracker (Fixed, Duplicate, ...) */
    String resolution;

    /** Root cause as reported by the tracker, when the source carries one */
    String rootCause;

    String assignee;

    String reporter;

    @NonNull
    Instant createdAt;

    Instant updatedAt;

    Instant resolvedAt;

    /** Source fields with no canonical counterpart, sorted by name */
    @Singular
    SortedMap<String, Object> rawFields;

    public boolean isResolved() {
        return resolvedAt != null;
    }

    /**
     * Summary and description joined for free-text scanning, in reading order.
     */
    public String searchableText() {
        StringBuilder text = new StringBuilder();
        if (summary != null) {
            text.append(summary);
        }
        if (description != null && !description.isBlank()) {
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append(description);
        }
        return text.toString();
    }
}
