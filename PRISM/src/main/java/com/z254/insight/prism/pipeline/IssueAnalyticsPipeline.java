package com.z254.insight.prism.pipeline;

import com.z254.insight.prism.aggregate.BucketDimension;
import com.z254.insight.prism.aggregate.IssueAggregator;
import com.z254.insight.prism.aggregate.SummaryCalculator;
import com.z254.insight.prism.aggregate.TableSpec;
import com.z254.insight.prism.config.PipelineConfiguration;
import com.z254.insight.prism.domain.model.*;
import com.z254.insight.prism.enrich.IssueEnricher;
import com.z254.insight.prism.error.CapacityExceededException;
import com.z254.insight.prism.error.NoUsableRecordsException;
import com.z254.insight.prism.error.PrismException;
import com.z254.insight.prism.extract.CustomerExtractor;
import com.z254.insight.prism.extract.IntegrationAppExtractor;
import com.z254.insight.prism.extract.RootCauseClassifier;
import com.z254.insight.prism.normalize.NormalizationResult;
import com.z254.insight.prism.normalize.RecordNormalizer;
import com.z254.insight.prism.normalize.TimestampParser;
import com.z254.insight.prism.observability.PrismMetrics;
import com.z254.insight.prism.observability.PrismStructuredLogger;
import com.z254.insight.prism.observability.PrismStructuredLogger.RecordEventType;
import com.z254.insight.prism.observability.PrismStructuredLogger.RunEventType;
import com.z254.insight.prism.source.IssueSource;
import com.z254.insight.prism.temporal.TemporalEnricher;
import com.z254.insight.prism.trend.TrendDetector;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.*;

/**
 * Runs one batch of raw issue records through normalization, enrichment, aggregation,
 * trend detection and summaries.
 * <p>
 * Each run is a pure function of the records and the {@link PipelineConfiguration}: the
 * pipeline keeps no state between runs, and identical input yields identical results.
 * Bad records are reported and skipped; a batch over capacity or without a single usable
 * record fails the run. Exceptions from an {@link IssueSource} reach the caller unchanged.
 */
@Slf4j
@Service
public class IssueAnalyticsPipeline {

    private final PipelineConfiguration defaultConfiguration;
    private final PrismMetrics metrics;
    private final PrismStructuredLogger structuredLogger;

    public IssueAnalyticsPipeline(PipelineConfiguration defaultConfiguration,
                                  PrismMetrics metrics,
                                  PrismStructuredLogger structuredLogger) {
        this.defaultConfiguration = defaultConfiguration;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    public PipelineResult run(IssueSource source) {
        String description = source.describe();
        try (var scope = structuredLogger.withContext(Map.of(PrismStructuredLogger.MDC_SOURCE, description))) {
            log.info("Fetching records from {}", description);
            return run(source.fetch(), defaultConfiguration);
        }
    }

    public PipelineResult run(Iterable<? extends Map<String, ?>> records) {
        return run(records, defaultConfiguration);
    }

    public PipelineResult run(Iterable<? extends Map<String, ?>> records, PipelineConfiguration configuration) {
        String runId = UUID.randomUUID().toString();
        try (var scope = structuredLogger.withRunId(runId)) {
            Timer.Sample sample = metrics.startRun();
            try {
                PipelineResult result = execute(runId, records, configuration);
                metrics.recordRunCompleted(sample, result.getNormalizationReport().getRecordsUsable());
                return result;
            } catch (PrismException e) {
                metrics.recordRunFailed(sample);
                structuredLogger.logRunEvent(runId,
                        e instanceof CapacityExceededException ? RunEventType.REJECTED : RunEventType.FAILED,
                        "Pipeline run failed: " + e.getMessage(),
                        Map.of("error", e.getClass().getSimpleName()));
                throw e;
            }
        }
    }

    private PipelineResult execute(String runId,
                                   Iterable<? extends Map<String, ?>> records,
                                   PipelineConfiguration configuration) {
        List<Map<String, ?>> batch = materialize(records, configuration.getMaxRecords());
        structuredLogger.logRunEvent(runId, RunEventType.STARTED, "Pipeline run started",
                Map.of("records", batch.size(), "parallel", configuration.isParallel()));

        RecordNormalizer normalizer = new RecordNormalizer(
                configuration.getFieldAliases(),
                new TimestampParser(configuration.getDateFormats(), configuration.getZone()),
                configuration.getMaxMonthSpan(),
                structuredLogger);
        NormalizationResult normalized = structuredLogger.timed("normalize",
                () -> normalizer.normalize(batch, configuration.isParallel()));

        List<Issue> inScope = new ArrayList<>();
        for (Issue issue : normalized.getIssues()) {
            if (inScope(issue, configuration)) {
                inScope.add(issue);
            } else {
                structuredLogger.logRecordEvent(-1, issue.getId(), RecordEventType.OUT_OF_SCOPE,
                        "Issue outside the analysis scope");
            }
        }
        NormalizationReport report = normalized.getReport().toBuilder()
                .recordsOutOfScope(normalized.getIssues().size() - inScope.size())
                .build();
        recordNormalization(runId, report);

        if (inScope.isEmpty()) {
            throw new NoUsableRecordsException(report);
        }

        IssueEnricher enricher = new IssueEnricher(
                new TemporalEnricher(configuration.getZone(), configuration.getHolidayCalendar()),
                new IntegrationAppExtractor(configuration.getAppRules()),
                new CustomerExtractor(configuration.getCustomerRules()),
                new RootCauseClassifier(configuration.getRootCauseRules()));
        List<EnrichedIssue> enriched = structuredLogger.timed("enrich",
                () -> enricher.enrichAll(inScope, configuration.isParallel()));
        recordEnrichment(runId, enriched);

        IssueAggregator aggregator = new IssueAggregator(configuration.getHolidayCalendar());
        TrendDetector trendDetector = new TrendDetector(configuration.getTrendSettings());
        Map<String, AggregationTable> tables = new LinkedHashMap<>();
        Map<String, List<CategoryTotal>> rankings = new LinkedHashMap<>();
        Map<String, List<TrendSeries>> trends = new LinkedHashMap<>();

        structuredLogger.timed("aggregate", () -> {
            for (TableSpec spec : configuration.getTables()) {
                AggregationTable table = aggregator.aggregate(spec, enriched);
                tables.put(table.getName(), table);
                rankings.put(table.getName(), table.topCategories(configuration.getTopN()));
                metrics.recordTable(table.getCategories().size());
                if (spec.getBucket() == BucketDimension.MONTH) {
                    List<TrendSeries> series = trendDetector.detectAll(table);
                    trends.put(table.getName(), series);
                    metrics.recordAnomalies(series.stream().mapToInt(s -> s.getAnomalousBuckets().size()).sum());
                }
            }
            return tables.size();
        });
        structuredLogger.logRunEvent(runId, RunEventType.AGGREGATED, "Tables built",
                Map.of("tables", tables.size(), "trendTables", trends.size()));

        AnalyticsSummary summary = new SummaryCalculator(configuration.getHolidayCalendar())
                .summarize(enriched, tables.values());

        structuredLogger.logRunEvent(runId, RunEventType.COMPLETED, "Pipeline run completed",
                Map.of("issues", enriched.size(), "tables", tables.size()));

        return PipelineResult.builder()
                .normalizationReport(report)
                .enrichedIssues(enriched)
                .tables(Collections.unmodifiableMap(tables))
                .rankings(Collections.unmodifiableMap(rankings))
                .trends(Collections.unmodifiableMap(trends))
                .summary(summary)
                .build();
    }

    /**
     * Copies the records, counting past the ceiling so the error can report the real size.
     */
    private List<Map<String, ?>> materialize(Iterable<? extends Map<String, ?>> records, int maxRecords) {
        List<Map<String, ?>> batch = new ArrayList<>();
        long observed = 0;
        for (Map<String, ?> record : records) {
            observed++;
            if (observed <= maxRecords) {
                batch.add(record);
            }
        }
        if (observed > maxRecords) {
            throw new CapacityExceededException(observed, maxRecords);
        }
        return batch;
    }

    private boolean inScope(Issue issue, PipelineConfiguration configuration) {
        LocalDate created = issue.getCreatedAt().atZone(configuration.getZone()).toLocalDate();
        if (configuration.getStartDate() != null && created.isBefore(configuration.getStartDate())) {
            return false;
        }
        if (configuration.getEndDate() != null && created.isAfter(configuration.getEndDate())) {
            return false;
        }
        return configuration.getProjectKey() == null
                || issue.getId().startsWith(configuration.getProjectKey() + "-");
    }

    private void recordNormalization(String runId, NormalizationReport report) {
        metrics.recordNormalization(report.getRecordsReceived(), report.getRecordsNormalized(),
                report.getRecordsOutOfScope());
        report.getFailures().forEach(failure -> metrics.recordRejection(failure.getReason()));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("received", report.getRecordsReceived());
        details.put("normalized", report.getRecordsNormalized());
        details.put("rejected", report.getFailures().size());
        details.put("outOfScope", report.getRecordsOutOfScope());
        details.put("warnings", report.getWarnings().size());
        if (report.hasFailures()) {
            details.put("rejectedByReason", report.getFailureCountsByReason());
            structuredLogger.logRunEvent(runId, RunEventType.PARTIAL_FAILURE,
                    "Some records could not be normalized", details);
        } else {
            structuredLogger.logRunEvent(runId, RunEventType.NORMALIZED, "Records normalized", details);
        }
    }

    private void recordEnrichment(String runId, List<EnrichedIssue> enriched) {
        Map<ExtractionConfidence, Integer> byConfidence = new EnumMap<>(ExtractionConfidence.class);
        for (EnrichedIssue issue : enriched) {
            metrics.recordCustomerExtraction(issue.getExtractionConfidence());
            byConfidence.merge(issue.getExtractionConfidence(), 1, Integer::sum);
            if (EnrichedIssue.UNKNOWN.equals(issue.getIntegrationApp())) {
                metrics.recordUnknownIntegrationApp();
            }
        }
        structuredLogger.logRunEvent(runId, RunEventType.ENRICHED, "Issues enriched",
                Map.of("issues", enriched.size(), "customerConfidence", byConfidence));
    }
}
