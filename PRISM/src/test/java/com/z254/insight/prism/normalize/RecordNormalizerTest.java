package com.z254.insight.prism.normalize;

import com.z254.insight.prism.config.PipelineConfiguration;
import com.z254.insight.prism.domain.model.Issue;
import com.z254.insight.prism.domain.model.NormalizationFailure;
import com.z254.insight.prism.observability.PrismStructuredLogger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.*;

import static com.z254.insight.prism.IssueFixtures.record;
import static com.z254.insight.prism.IssueFixtures.resolvedRecord;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RecordNormalizerTest {

    @Mock
    private PrismStructuredLogger structuredLogger;

    private RecordNormalizer normalizer;

    @BeforeEach
    void setUp() {
        PipelineConfiguration configuration = PipelineConfiguration.defaults();
        normalizer = new RecordNormalizer(configuration.getFieldAliases(),
                new TimestampParser(configuration.getDateFormats(), configuration.getZone()),
                configuration.getMaxMonthSpan(),
                structuredLogger);
    }

    @Test
    void rejectsCreationDatesFarFromTheBatch() {
        NormalizationResult result = normalizer.normalize(List.of(
                record("INT-1", "2024-01-05", "January"),
                record("INT-2", "0024-01-05", "Mistyped year"),
                record("INT-3", "2024-02-01", "February"),
                record("INT-4", "2033-12-01", "Nearly ten years later")), false);

        assertThat(result.getIssues()).extracting(Issue::getId).containsExactly("INT-1", "INT-3", "INT-4");
        assertThat(result.getReport().getFailures()).containsExactly(
                new NormalizationFailure(1, "INT-2", RecordNormalizer.REASON_CREATED_OUT_OF_SPAN));
        assertThat(result.getReport().getRecordsNormalized()).isEqualTo(3);
        verify(structuredLogger).logRecordEvent(eq(1), eq("INT-2"),
                eq(PrismStructuredLogger.RecordEventType.REJECTED), anyString());
    }

    @Test
    void mapsAliasesOntoCanonicalFields() {
        Map<String, Object> spreadsheetRow = new LinkedHashMap<>();
        spreadsheetRow.put("JIRA ID", "INT-101");
        spreadsheetRow.put("JIRA Text/Summary", "Customer: Acme Corp - Salesforce sync failing");
        spreadsheetRow.put("created date", "2024-11-21 09:00:00");
        spreadsheetRow.put("Resolved Date", "2024-11-23 09:00:00");
        spreadsheetRow.put("Priority", "High");
        spreadsheetRow.put("Customer Tier", "Gold");

        NormalizationResult result = normalizer.normalize(List.of(spreadsheetRow), false);

        assertThat(result.getIssues()).hasSize(1);
        Issue issue = result.getIssues().get(0);
        assertThat(issue.getId()).isEqualTo("INT-101");
        assertThat(issue.getSummary()).isEqualTo("Customer: Acme Corp - Salesforce sync failing");
        assertThat(issue.getCreatedAt()).isEqualTo(Instant.parse("2024-11-21T09:00:00Z"));
        assertThat(issue.getResolvedAt()).isEqualTo(Instant.parse("2024-11-23T09:00:00Z"));
        assertThat(issue.getPriority()).isEqualTo("High");
        assertThat(issue.getRawFields()).containsOnlyKeys("Customer Tier");
        assertThat(result.getReport().hasFailures()).isFalse();
    }

    @Test
    void flattensNestedTrackerValues() {
        Map<String, Object> record = record("INT-7", "2024-03-02", "Export failing");
        record.put("priority", Map.of("name", "Critical"));
        record.put("assignee", Map.of("displayName", "Dana Scully", "accountId", "abc"));

        Issue issue = normalizer.normalize(List.of(record), false).getIssues().get(0);

        assertThat(issue.getPriority()).isEqualTo("Critical");
        assertThat(issue.getAssignee()).isEqualTo("Dana Scully");
    }

    @Test
    void recordWithoutIdIsRejectedAndReported() {
        Map<String, Object> noId = new HashMap<>(record("ignored", "2024-01-05", "Orphan record"));
        noId.remove("key");

        NormalizationResult result = normalizer.normalize(
                List.of(record("INT-1", "2024-01-05", "Kept"), noId), false);

        assertThat(result.getIssues()).extracting(Issue::getId).containsExactly("INT-1");
        assertThat(result.getReport().getFailures())
                .containsExactly(new NormalizationFailure(1, null, RecordNormalizer.REASON_MISSING_ID));
        assertThat(result.getReport().getRecordsReceived()).isEqualTo(2);
        assertThat(result.getReport().getRecordsNormalized()).isEqualTo(1);
        verify(structuredLogger).logRecordEvent(eq(1), isNull(),
                eq(PrismStructuredLogger.RecordEventType.REJECTED), anyString());
    }

    @Test
    void missingOrUnparseableCreationDateRejectsRecord() {
        Map<String, Object> noCreated = new HashMap<>(record("INT-2", "x", "No date"));
        noCreated.remove("created");

        NormalizationResult result = normalizer.normalize(
                List.of(noCreated, record("INT-3", "sometime last week", "Bad date")), false);

        assertThat(result.getIssues()).isEmpty();
        assertThat(result.getReport().getFailureCountsByReason()).containsOnly(
                Map.entry(RecordNormalizer.REASON_MISSING_CREATED, 1L),
                Map.entry(RecordNormalizer.REASON_UNPARSEABLE_CREATED, 1L));
        assertThat(result.getReport().getFailures()).extracting(NormalizationFailure::getRecordId)
                .containsExactly("INT-2", "INT-3");
    }

    @Test
    void unparseableOptionalDateIsDroppedWithWarning() {
        NormalizationResult result = normalizer.normalize(
                List.of(resolvedRecord("INT-4", "2024-02-01", "soon", "Pending")), false);

        assertThat(result.getIssues()).singleElement()
                .satisfies(issue -> assertThat(issue.getResolvedAt()).isNull());
        assertThat(result.getReport().getWarnings()).singleElement().asString()
                .contains("INT-4").contains("resolved_at");
        assertThat(result.getReport().hasFailures()).isFalse();
    }

    @Test
    void resolutionBeforeCreationIsDropped() {
        NormalizationResult result = normalizer.normalize(
                List.of(resolvedRecord("INT-5", "2024-02-10", "2024-02-01", "Clock skew")), false);

        Issue issue = result.getIssues().get(0);
        assertThat(issue.getResolvedAt()).isNull();
        assertThat(issue.isResolved()).isFalse();
        assertThat(result.getReport().getWarnings()).hasSize(1);
    }

    @Test
    void duplicateIdKeepsFirstOccurrence() {
        NormalizationResult result = normalizer.normalize(List.of(
                record("INT-6", "2024-02-10", "First"),
                record("INT-6", "2024-02-11", "Second")), false);

        assertThat(result.getIssues()).singleElement()
                .satisfies(issue -> assertThat(issue.getSummary()).isEqualTo("First"));
        assertThat(result.getReport().getFailures())
                .containsExactly(new NormalizationFailure(1, "INT-6", RecordNormalizer.REASON_DUPLICATE_ID));
    }

    @Test
    void nullRecordIsReportedNotFatal() {
        NormalizationResult result = normalizer.normalize(
                Arrays.asList(null, record("INT-8", "2024-02-10", "Fine")), false);

        assertThat(result.getIssues()).hasSize(1);
        assertThat(result.getReport().getFailures()).extracting(NormalizationFailure::getReason)
                .containsExactly(RecordNormalizer.REASON_NULL_RECORD);
    }

    @Test
    void parallelNormalizationMatchesSequential() {
        List<Map<String, Object>> records = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            records.add(record("INT-" + (i % 150), "2024-0" + (i % 9 + 1) + "-15", "Issue " + i));
        }

        NormalizationResult sequential = normalizer.normalize(records, false);
        NormalizationResult parallel = normalizer.normalize(records, true);

        assertThat(parallel.getIssues()).isEqualTo(sequential.getIssues());
        assertThat(parallel.getReport()).isEqualTo(sequential.getReport());
        assertThat(sequential.getReport().getFailures()).hasSize(50);
    }
}
