package com.z254.insight.prism.error;

import java.util.List;

/**
 * Raised when pattern lists, holiday ranges or thresholds are malformed.
 * Always thrown before any record is processed.
 */
public class ConfigurationException extends PrismException {

    private final List<String> problems;

    public ConfigurationException(List<String> problems) {
        super("Invalid PRISM configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
