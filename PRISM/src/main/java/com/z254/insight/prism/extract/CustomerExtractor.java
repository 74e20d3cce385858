package com.z254.insight.prism.extract;

import com.z254.insight.prism.domain.model.Issue;

import java.util.List;

/**
 * Recovers the customer name from an issue's summary and description.
 * <p>
 * The result is a best-effort signal; its {@link com.z254.insight.prism.domain.model.ExtractionConfidence}
 * travels with the value so reports can tell an explicit {@code Customer:} marker from a
 * guessed capitalized token.
 */
public class CustomerExtractor {

    private final RuleChain rules;

    public CustomerExtractor(List<CustomerRule> customerRules) {
        this.rules = new RuleChain(customerRules);
    }

    public ExtractionResult extract(Issue issue) {
        return extract(issue.searchableText());
    }

    public ExtractionResult extract(String text) {
        return rules.evaluate(text);
    }
}
