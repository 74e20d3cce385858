package com.z254.insight.prism.normalize;

import java.util.Arrays;
import java.util.Optional;

/**
 * Fields of the canonical {@link com.z254.insight.prism.domain.model.Issue} schema,
 * keyed the way they appear under {@code prism.normalization.field-aliases}.
 */
public enum CanonicalField {

    ID("id", true),
    SUMMARY("summary", false),
    DESCRIPTION("description", false),
    STATUS("status", false),
    PRIORITY("priority", false),
    ISSUE_TYPE("issue-type", false),
    RESOLUTION("resolution", false),
    ROOT_CAUSE("root-cause", false),
    ASSIGNEE("assignee", false),
    REPORTER("reporter", false),
    CREATED_AT("created-at", true),
    UPDATED_AT("updated-at", false),
    RESOLVED_AT("resolved-at", false);

    private final String key;
    private final boolean required;

    CanonicalField(String key, boolean required) {
        this.key = key;
        this.required = required;
    }

    public String getKey() {
        return key;
    }

    public boolean isRequired() {
        return required;
    }

    public boolean isTimestamp() {
        return this == CREATED_AT || this == UPDATED_AT || this == RESOLVED_AT;
    }

    public static Optional<CanonicalField> fromKey(String key) {
        return Arrays.stream(values())
                .filter(field -> field.key.equalsIgnoreCase(key) || field.name().equalsIgnoreCase(key))
                .findFirst();
    }
}
