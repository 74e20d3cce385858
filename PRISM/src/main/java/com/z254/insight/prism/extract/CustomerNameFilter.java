package com.z254.insight.prism.extract;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleans customer-name candidates and rejects the ones that cannot be a customer.
 * <p>
 * A candidate is rejected when it is a stop value, when it starts with the name of a known
 * integration app, or (strict mode) when nothing but common ticket vocabulary remains once
 * leading and trailing excluded terms are dropped.
 */
public final class CustomerNameFilter {

    private static final Set<String> CONNECTORS = Set.of("&", "of", "and", "de");
    private static final Pattern TIER_ANNOTATION = Pattern.compile("\\(\\s*tier\\s*\\d+\\s*\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern MARKUP_PREFIX = Pattern.compile("^(?:h\\d\\.|[*#_>]+)\\s*");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[\\s\"'`.,;:!?-]+|[\\s\"'`.,;:!?-]+$");

    private final Set<String> stopValues;
    private final Set<String> excludedTerms;
    private final List<Pattern> appPatterns;

    public CustomerNameFilter(Collection<String> stopValues,
                              Collection<String> excludedTerms,
                              Collection<Pattern> appPatterns) {
        this.stopValues = lowerCase(stopValues);
        this.excludedTerms = lowerCase(excludedTerms);
        this.appPatterns = List.copyOf(appPatterns);
    }

    public Optional<String> accept(String candidate, boolean strict) {
        if (candidate == null) {
            return Optional.empty();
        }
        String cleaned = clean(candidate);
        cleaned = cutAtApplicationName(cleaned);
        if (strict) {
            cleaned = trimExcludedTerms(cleaned);
        }
        if (cleaned.length() < 2 || stopValues.contains(cleaned.toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }
        return Optional.of(cleaned);
    }

    public boolean isExcluded(String word) {
        return excludedTerms.contains(normalizeWord(word));
    }

    private String clean(String candidate) {
        String cleaned = candidate;
        int pipe = cleaned.indexOf("||");
        if (pipe >= 0) {
            cleaned = cleaned.substring(0, pipe);
        }
        cleaned = TIER_ANNOTATION.matcher(cleaned).replaceAll(" ");
        int paren = cleaned.indexOf('(');
        if (paren >= 0) {
            cleaned = cleaned.substring(0, paren);
        }
        cleaned = MARKUP_PREFIX.matcher(cleaned.trim()).replaceFirst("");
        cleaned = EDGE_PUNCTUATION.matcher(cleaned).replaceAll("");
        return cleaned.replaceAll("\\s+", " ");
    }

    private String cutAtApplicationName(String candidate) {
        int cut = candidate.length();
        for (Pattern app : appPatterns) {
            Matcher matcher = app.matcher(candidate);
            if (matcher.find()) {
                cut = Math.min(cut, matcher.start());
            }
        }
        return EDGE_PUNCTUATION.matcher(candidate.substring(0, cut)).replaceAll("");
    }

    private String trimExcludedTerms(String candidate) {
        if (candidate.isEmpty()) {
            return candidate;
        }
        String[] words = candidate.split(" ");
        int start = 0;
        while (start < words.length && (isExcluded(words[start]) || isConnector(words[start]))) {
            start++;
        }
        List<String> kept = new ArrayList<>();
        for (int i = start; i < words.length; i++) {
            String word = words[i];
            if (isConnector(word)) {
                boolean joinsName = i + 1 < words.length && !isExcluded(words[i + 1]) && !isConnector(words[i + 1]);
                if (!joinsName) {
                    break;
                }
            } else if (isExcluded(word)) {
                break;
            }
            kept.add(word);
        }
        return EDGE_PUNCTUATION.matcher(String.join(" ", kept)).replaceAll("");
    }

    private static boolean isConnector(String word) {
        return CONNECTORS.contains(word.toLowerCase(Locale.ROOT));
    }

    private static String normalizeWord(String word) {
        return EDGE_PUNCTUATION.matcher(word).replaceAll("").toLowerCase(Locale.ROOT);
    }

    private static Set<String> lowerCase(Collection<String> values) {
        Set<String> lower = new HashSet<>();
        values.forEach(value -> lower.add(value.trim().toLowerCase(Locale.ROOT)));
        return Set.copyOf(lower);
    }
}
