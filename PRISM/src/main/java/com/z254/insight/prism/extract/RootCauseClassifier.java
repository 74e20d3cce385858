package com.z254.insight.prism.extract;

import com.z254.insight.prism.domain.model.Issue;

import java.util.List;

/**
 * Assigns a root-cause category. A root cause reported by the tracker is kept as is;
 * otherwise keyword rules are applied to the issue text.
 */
public class RootCauseClassifier {

    private final RuleChain rules;

    public RootCauseClassifier(List<PatternRule> rootCauseRules) {
        this.rules = new RuleChain(rootCauseRules);
    }

    public String classify(Issue issue) {
        if (issue.getRootCause() != null && !issue.getRootCause().isBlank()) {
            return issue.getRootCause().trim();
        }
        return rules.evaluate(issue.searchableText()).getValue();
    }
}
