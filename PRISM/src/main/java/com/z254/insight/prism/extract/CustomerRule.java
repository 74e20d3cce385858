package com.z254.insight.prism.extract;

import com.z254.insight.prism.domain.model.ExtractionConfidence;
import lombok.Getter;

import java.util.Collection;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Customer-name rule: a candidate pattern plus the shared {@link CustomerNameFilter}.
 * Occurrences are tried in reading order; a rejected candidate moves on to the next one.
 */
@Getter
public final class CustomerRule implements ExtractionRule {

    private static final String CAPITALIZED_WORD = "\\p{Lu}[\\p{L}\\p{N}&'.\\-]*";
    private static final String CAPITALIZED_RUN = CAPITALIZED_WORD
            + "(?:[ \\t]+(?:(?:&|of|and|de)[ \\t]+)?" + CAPITALIZED_WORD + ")*";

    private final String name;
    private final ExtractionConfidence confidence;
    private final CustomerRuleType type;
    private final Pattern pattern;
    private final CustomerNameFilter filter;

    private CustomerRule(String name,
                         ExtractionConfidence confidence,
                         CustomerRuleType type,
                         Pattern pattern,
                         CustomerNameFilter filter) {
        this.name = name;
        this.confidence = confidence;
        this.type = type;
        this.pattern = pattern;
        this.filter = filter;
    }

    public static CustomerRule marker(String name, ExtractionConfidence confidence,
                                      Collection<String> markerTerms, CustomerNameFilter filter) {
        Pattern pattern = Pattern.compile("(?iu:\\b(?:" + alternatives(markerTerms) + ")(?:[ \\t]+name)?)"
                + "[ \\t]*:[ \\t]*(" + CAPITALIZED_RUN + ")");
        return new CustomerRule(name, confidence, CustomerRuleType.MARKER, pattern, filter);
    }

    public static CustomerRule trigger(String name, ExtractionConfidence confidence,
                                       Collection<String> triggerWords, CustomerNameFilter filter) {
        Pattern pattern = Pattern.compile("(?iu:\\b(?:" + alternatives(triggerWords) + "))"
                + "[ \\t]+(" + CAPITALIZED_RUN + ")");
        return new CustomerRule(name, confidence, CustomerRuleType.TRIGGER, pattern, filter);
    }

    public static CustomerRule capitalizedToken(String name, ExtractionConfidence confidence, CustomerNameFilter filter) {
        Pattern pattern = Pattern.compile("(?<![\\p{L}\\p{N}])(\\p{Lu}[\\p{L}\\p{N}&'\\-]*)");
        return new CustomerRule(name, confidence, CustomerRuleType.CAPITALIZED_TOKEN, pattern, filter);
    }

    public static CustomerRule regex(String name, ExtractionConfidence confidence, String regex, CustomerNameFilter filter) {
        Pattern pattern = Pattern.compile(regex);
        if (pattern.matcher("").groupCount() < 1) {
            throw new IllegalArgumentException("customer pattern '" + name + "' needs a capturing group for the name");
        }
        return new CustomerRule(name, confidence, CustomerRuleType.REGEX, pattern, filter);
    }

    @Override
    public Optional<String> apply(String text) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            Optional<String> accepted = filter.accept(matcher.group(1), type.isStrict());
            if (accepted.isPresent()) {
                return accepted;
            }
        }
        return Optional.empty();
    }

    private static String alternatives(Collection<String> terms) {
        return terms.stream()
                .map(String::trim)
                .filter(term -> !term.isEmpty())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
    }
}
