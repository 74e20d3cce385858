package com.z254.insight.prism.extract;

/**
 * How a customer rule locates candidates in free text.
 */
public enum CustomerRuleType {

    /** {@code Customer: Acme Corp}, {@code Account Name: Acme Corp} */
    MARKER(false),

    /** Capitalized words right after a trigger word: {@code ... failing for Acme Corp} */
    TRIGGER(true),

    /** First capitalized token that survives the filter */
    CAPITALIZED_TOKEN(true),

    /** Custom pattern; the first capturing group holds the name */
    REGEX(false);

    private final boolean strict;

    CustomerRuleType(boolean strict) {
        this.strict = strict;
    }

    /**
     * Strict rules trim and reject common ticket vocabulary; marker and regex rules trust
     * the position they matched.
     */
    public boolean isStrict() {
        return strict;
    }
}
