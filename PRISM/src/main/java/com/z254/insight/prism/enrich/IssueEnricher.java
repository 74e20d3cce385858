package com.z254.insight.prism.enrich;

import com.z254.insight.prism.domain.model.EnrichedIssue;
import com.z254.insight.prism.domain.model.Issue;
import com.z254.insight.prism.extract.CustomerExtractor;
import com.z254.insight.prism.extract.ExtractionResult;
import com.z254.insight.prism.extract.IntegrationAppExtractor;
import com.z254.insight.prism.extract.RootCauseClassifier;
import com.z254.insight.prism.temporal.TemporalEnricher;
import com.z254.insight.prism.temporal.TemporalEnricher.TemporalAttributes;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Derives every {@link EnrichedIssue} attribute from an {@link Issue}.
 * <p>
 * Enrichment is a pure function of the issue and the configured rules, so issues can be
 * enriched in any order or in parallel; the output is always sorted by creation time, then id.
 */
public class IssueEnricher {

    public static final Comparator<EnrichedIssue> CHRONOLOGICAL =
            Comparator.comparing((EnrichedIssue issue) -> issue.getIssue().getCreatedAt())
                    .thenComparing(EnrichedIssue::getId);

    private final TemporalEnricher temporalEnricher;
    private final IntegrationAppExtractor appExtractor;
    private final CustomerExtractor customerExtractor;
    private final RootCauseClassifier rootCauseClassifier;

    public IssueEnricher(TemporalEnricher temporalEnricher,
                         IntegrationAppExtractor appExtractor,
                         CustomerExtractor customerExtractor,
                         RootCauseClassifier rootCauseClassifier) {
        this.temporalEnricher = temporalEnricher;
        this.appExtractor = appExtractor;
        this.customerExtractor = customerExtractor;
        this.rootCauseClassifier = rootCauseClassifier;
    }

    public EnrichedIssue enrich(Issue issue) {
        TemporalAttributes temporal = temporalEnricher.enrich(issue);
        ExtractionResult customer = customerExtractor.extract(issue);
        return EnrichedIssue.builder()
                .issue(issue)
                .monthYear(temporal.getMonthYear())
                .quarter(temporal.getQuarter())
                .resolutionTime(temporal.getResolutionTime())
                .holidayPeriod(temporal.getHolidayPeriod())
                .holidaySeason(temporal.isHolidaySeason())
                .integrationApp(appExtractor.extract(issue))
                .customer(customer.getValue())
                .extractionConfidence(customer.getConfidence())
                .rootCause(rootCauseClassifier.classify(issue))
                .build();
    }

    public List<EnrichedIssue> enrichAll(List<Issue> issues, boolean parallel) {
        Stream<Issue> stream = parallel ? issues.parallelStream() : issues.stream();
        return stream.map(this::enrich)
                .sorted(CHRONOLOGICAL)
                .collect(Collectors.toUnmodifiableList());
    }
}
