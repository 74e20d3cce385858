package com.z254.insight.prism.observability;

import com.z254.insight.prism.domain.model.ExtractionConfidence;
import io.micrometer.core.instrument.*;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for PRISM.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Pipeline runs (started, completed, failed, duration)</li>
 *     <li>Normalization (received, normalized, rejected by reason, out of scope)</li>
 *     <li>Extraction outcome per confidence class</li>
 *     <li>Anomalies flagged by the trend detector</li>
 * </ul>
 */
@Component
public class PrismMetrics {

    private final MeterRegistry meterRegistry;

    // Run metrics
    @Getter
    private final Counter runsStarted;
    @Getter
    private final Counter runsCompleted;
    @Getter
    private final Counter runsFailed;
    private final Timer runDuration;
    private final AtomicInteger lastRunUsableRecords;

    // Normalization metrics
    @Getter
    private final Counter recordsReceived;
    @Getter
    private final Counter recordsNormalized;
    @Getter
    private final Counter recordsRejected;
    @Getter
    private final Counter recordsOutOfScope;
    private final Map<String, Counter> rejectionsByReason = new ConcurrentHashMap<>();

    // Enrichment metrics
    private final Map<ExtractionConfidence, Counter> customersByConfidence = new EnumMap<>(ExtractionConfidence.class);
    @Getter
    private final Counter unknownIntegrationApps;
    @Getter
    private final Counter anomaliesFlagged;
    private final DistributionSummary tableCategories;

    public PrismMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.runsStarted = Counter.builder("prism.runs.started")
                .description("Pipeline runs started")
                .register(meterRegistry);
        this.runsCompleted = Counter.builder("prism.runs.completed")
                .description("Pipeline runs completed successfully")
                .register(meterRegistry);
        this.runsFailed = Counter.builder("prism.runs.failed")
                .description("Pipeline runs aborted by a systemic failure")
                .register(meterRegistry);
        this.runDuration = Timer.builder("prism.runs.duration")
                .description("Pipeline run duration")
                .publishPercentiles(0.5, 0.95)
                .register(meterRegistry);
        this.lastRunUsableRecords = meterRegistry.gauge("prism.runs.last.usable_records", new AtomicInteger(0));

        this.recordsReceived = Counter.builder("prism.records.received")
                .description("Raw records handed to the normalizer")
                .register(meterRegistry);
        this.recordsNormalized = Counter.builder("prism.records.normalized")
                .description("Records normalized into issues")
                .register(meterRegistry);
        this.recordsRejected = Counter.builder("prism.records.rejected")
                .description("Records rejected by the normalizer")
                .register(meterRegistry);
        this.recordsOutOfScope = Counter.builder("prism.records.out_of_scope")
                .description("Issues outside the analysis window or project")
                .register(meterRegistry);

        for (ExtractionConfidence confidence : ExtractionConfidence.values()) {
            customersByConfidence.put(confidence, Counter.builder("prism.extraction.customers")
                    .tag("confidence", confidence.name().toLowerCase(Locale.ROOT))
                    .description("Customer extraction outcome by confidence class")
                    .register(meterRegistry));
        }
        this.unknownIntegrationApps = Counter.builder("prism.extraction.integration_app.unknown")
                .description("Issues without a recognizable integration app")
                .register(meterRegistry);
        this.anomaliesFlagged = Counter.builder("prism.trend.anomalies")
                .description("Anomalous buckets flagged")
                .register(meterRegistry);
        this.tableCategories = DistributionSummary.builder("prism.tables.categories")
                .description("Number of category rows per aggregation table")
                .register(meterRegistry);
    }

    // ========== Run Methods ==========

    public Timer.Sample startRun() {
        runsStarted.increment();
        return Timer.start(meterRegistry);
    }

    public void recordRunCompleted(Timer.Sample sample, int usableRecords) {
        sample.stop(runDuration);
        runsCompleted.increment();
        lastRunUsableRecords.set(usableRecords);
    }

    public void recordRunFailed(Timer.Sample sample) {
        sample.stop(runDuration);
        runsFailed.increment();
        lastRunUsableRecords.set(0);
    }

    // ========== Normalization Methods ==========

    public void recordNormalization(int received, int normalized, int outOfScope) {
        recordsReceived.increment(received);
        recordsNormalized.increment(normalized);
        recordsOutOfScope.increment(outOfScope);
    }

    public void recordRejection(String reason) {
        recordsRejected.increment();
        rejectionsByReason.computeIfAbsent(reason, r ->
                Counter.builder("prism.records.rejected.by_reason")
                        .tag("reason", r)
                        .description("Rejected records by reason")
                        .register(meterRegistry))
                .increment();
    }

    // ========== Enrichment Methods ==========

    public void recordCustomerExtraction(ExtractionConfidence confidence) {
        customersByConfidence.get(confidence).increment();
    }

    public void recordUnknownIntegrationApp() {
        unknownIntegrationApps.increment();
    }

    public Counter getCustomersByConfidence(ExtractionConfidence confidence) {
        return customersByConfidence.get(confidence);
    }

    // ========== Aggregation Methods ==========

    public void recordTable(int categories) {
        tableCategories.record(categories);
    }

    public void recordAnomalies(int count) {
        anomaliesFlagged.increment(count);
    }
}
