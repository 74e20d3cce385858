package com.z254.insight.prism.extract;

import com.z254.insight.prism.domain.model.Issue;

import java.util.List;

/**
 * Finds the integration application an issue is about. Most specific pattern first;
 * no match yields {@code Unknown}.
 */
public class IntegrationAppExtractor {

    private final RuleChain rules;

    public IntegrationAppExtractor(List<PatternRule> appRules) {
        this.rules = new RuleChain(appRules);
    }

    public String extract(Issue issue) {
        return extract(issue.searchableText());
    }

    public String extract(String text) {
        return rules.evaluate(text).getValue();
    }
}
