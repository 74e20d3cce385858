package com.z254.insight.prism.extract;

import com.z254.insight.prism.domain.model.ExtractionConfidence;
import lombok.NonNull;
import lombok.Value;

import java.util.Collection;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Yields a fixed label whenever its pattern occurs in the text. Used for integration apps
 * and root-cause keywords.
 */
@Value
public class PatternRule implements ExtractionRule {

    @NonNull
    String name;

    @NonNull
    ExtractionConfidence confidence;

    @NonNull
    Pattern pattern;

    @Override
    public Optional<String> apply(String text) {
        return pattern.matcher(text).find() ? Optional.of(name) : Optional.empty();
    }

    /**
     * Case-insensitive match of the label itself as a whole word.
     */
    public static PatternRule forName(String name, ExtractionConfidence confidence) {
        return new PatternRule(name, confidence,
                Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(name) + "(?![\\p{L}\\p{N}])",
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }

    public static PatternRule forRegex(String name, ExtractionConfidence confidence, String regex) {
        return new PatternRule(name, confidence,
                Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }

    /**
     * Any keyword at the start of a word; {@code sync} also matches {@code syncing}.
     */
    public static PatternRule forKeywords(String name, ExtractionConfidence confidence, Collection<String> keywords) {
        String alternatives = keywords.stream()
                .map(String::trim)
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return new PatternRule(name, confidence,
                Pattern.compile("(?<![\\p{L}\\p{N}])(?:" + alternatives + ")",
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }
}
