package com.z254.insight.prism.extract;

import com.z254.insight.prism.config.PipelineConfiguration;
import com.z254.insight.prism.domain.model.EnrichedIssue;
import com.z254.insight.prism.domain.model.Issue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.z254.insight.prism.IssueFixtures.issue;
import static org.assertj.core.api.Assertions.assertThat;

class RootCauseClassifierTest {

    private RootCauseClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new RootCauseClassifier(PipelineConfiguration.defaults().getRootCauseRules());
    }

    @Test
    void firstMatchingRuleWins() {
        // "holiday" outranks "api" and "rate limit"
        Issue issue = issue("INT-1", "2024-11-25T10:00:00Z", "Salesforce API rate limit exceeded during holiday peak");

        assertThat(classifier.classify(issue)).isEqualTo("Holiday Season Volume");
    }

    @Test
    void keywordsMatchAtWordStart() {
        assertThat(classifier.classify(issue("INT-2", "2024-03-01T10:00:00Z", "Orders syncing slowly")))
                .isEqualTo("Data Synchronization Problem");
        assertThat(classifier.classify(issue("INT-3", "2024-03-01T10:00:00Z", "Token expired for NetSuite connection")))
                .isEqualTo("Authentication Failure");
        assertThat(classifier.classify(issue("INT-4", "2024-03-01T10:00:00Z", "Rapid growth in refunds")))
                .isEqualTo(EnrichedIssue.UNKNOWN);
    }

    @Test
    void sourceRootCauseIsKept() {
        Issue issue = issue("INT-5", "2024-03-01T10:00:00Z", "Sync error on invoices").toBuilder()
                .rootCause("Vendor Outage")
                .build();

        assertThat(classifier.classify(issue)).isEqualTo("Vendor Outage");
    }

    @Test
    void unmatchedTextIsUnknown() {
        assertThat(classifier.classify(issue("INT-6", "2024-03-01T10:00:00Z", "Dashboard looks odd")))
                .isEqualTo(EnrichedIssue.UNKNOWN);
    }
}
