package com.z254.insight.prism.extract;

import java.util.List;
import java.util.Optional;

/**
 * Ordered rule list evaluated top-down; the first rule that yields a value wins.
 */
public final class RuleChain {

    private final List<ExtractionRule> rules;

    public RuleChain(List<? extends ExtractionRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public ExtractionResult evaluate(String text) {
        if (text == null || text.isBlank()) {
            return ExtractionResult.unknown();
        }
        for (ExtractionRule rule : rules) {
            Optional<String> value = rule.apply(text);
            if (value.isPresent()) {
                return new ExtractionResult(value.get(), rule.getConfidence(), rule.getName());
            }
        }
        return ExtractionResult.unknown();
    }
}
