package com.z254.insight.prism.extract;

import com.z254.insight.prism.config.PipelineConfiguration;
import com.z254.insight.prism.domain.model.EnrichedIssue;
import com.z254.insight.prism.domain.model.ExtractionConfidence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IntegrationAppExtractorTest {

    private IntegrationAppExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new IntegrationAppExtractor(PipelineConfiguration.defaults().getAppRules());
    }

    @Test
    void matchesCaseInsensitively() {
        assertThat(extractor.extract("customer: acme corp - SALESFORCE integration failing")).isEqualTo("Salesforce");
        assertThat(extractor.extract("hubspot contacts duplicated")).isEqualTo("HubSpot");
    }

    @Test
    void moreSpecificPatternsWinByPriority() {
        assertThat(extractor.extract("NetSuite IA flow stuck pushing to Salesforce")).isEqualTo("NetSuite IA");
        assertThat(extractor.extract("Slack alerts from SAP Business ByDesign missing")).isEqualTo("SAP Business ByDesign");
    }

    @Test
    void priorityOrderNotTextOrderDecidesTies() {
        assertThat(extractor.extract("Zendesk ticket mirrored from Salesforce case")).isEqualTo("Salesforce");
    }

    @Test
    void matchesWholeWordsOnly() {
        assertThat(extractor.extract("Slackening order volume")).isEqualTo(EnrichedIssue.UNKNOWN);
        assertThat(extractor.extract("Orders stuck on laws update")).isEqualTo(EnrichedIssue.UNKNOWN);
    }

    @Test
    void aliasPatternsMapToCanonicalName() {
        assertThat(extractor.extract("MS Teams notifications delayed")).isEqualTo("Microsoft Teams");
        assertThat(extractor.extract("G Suite calendar sync")).isEqualTo("Google Workspace");
    }

    @Test
    void noMatchIsUnknown() {
        assertThat(extractor.extract("Warehouse printer offline")).isEqualTo(EnrichedIssue.UNKNOWN);
        assertThat(extractor.extract("")).isEqualTo(EnrichedIssue.UNKNOWN);
    }

    @Test
    void customRuleListIsEvaluatedTopDown() {
        IntegrationAppExtractor custom = new IntegrationAppExtractor(List.of(
                PatternRule.forRegex("Legacy ERP", ExtractionConfidence.HIGH, "\\berp\\b"),
                PatternRule.forName("Salesforce", ExtractionConfidence.HIGH)));

        assertThat(custom.extract("Salesforce push to ERP failed")).isEqualTo("Legacy ERP");
    }
}
