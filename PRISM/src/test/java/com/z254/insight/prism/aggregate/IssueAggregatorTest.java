package com.z254.insight.prism.aggregate;

import com.z254.insight.prism.config.PipelineConfiguration;
import com.z254.insight.prism.domain.model.AggregationTable;
import com.z254.insight.prism.domain.model.CategoryTotal;
import com.z254.insight.prism.domain.model.EnrichedIssue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.z254.insight.prism.IssueFixtures.enriched;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IssueAggregatorTest {

    private IssueAggregator aggregator;
    private List<EnrichedIssue> issues;

    @BeforeEach
    void setUp() {
        aggregator = new IssueAggregator(PipelineConfiguration.defaults().getHolidayCalendar());
        issues = List.of(
                enriched("INT-1", "2024-01", "Salesforce"),
                enriched("INT-2", "2024-01", "Salesforce"),
                enriched("INT-3", "2024-01", "HubSpot"),
                enriched("INT-4", "2024-02", "Salesforce"),
                enriched("INT-5", "2024-03", "HubSpot"),
                enriched("INT-6", "2024-03", "Shopify"),
                enriched("INT-7", "2024-03", "Shopify"),
                enriched("INT-8", "2024-03", EnrichedIssue.UNKNOWN));
    }

    @Test
    void countsAppsPerMonth() {
        AggregationTable table = aggregator.aggregate(
                new TableSpec(CategoryDimension.INTEGRATION_APP, BucketDimension.MONTH), issues);

        assertThat(table.getName()).isEqualTo("integration_app_by_month");
        assertThat(table.getBuckets()).containsExactly("2024-01", "2024-02", "2024-03");
        assertThat(table.count("Salesforce", "2024-01")).isEqualTo(2);
        assertThat(table.count("Salesforce", "2024-03")).isZero();
        assertThat(table.row("HubSpot")).containsExactly(1, 0, 1);
        assertThat(table.getColumnTotals()).containsEntry("2024-03", 4);
        assertThat(table.getGrandTotal()).isEqualTo(issues.size());
    }

    @Test
    void ranksByTotalThenName() {
        AggregationTable table = aggregator.aggregate(
                new TableSpec(CategoryDimension.INTEGRATION_APP, BucketDimension.MONTH), issues);

        // HubSpot and Shopify tie on 2
        assertThat(table.getCategories()).containsExactly("Salesforce", "HubSpot", "Shopify", "Unknown");
        assertThat(table.topCategories(2)).containsExactly(
                new CategoryTotal(1, "Salesforce", 3, new BigDecimal("37.50")),
                new CategoryTotal(2, "HubSpot", 2, new BigDecimal("25.00")));
        assertThat(table.topCategories(10)).hasSize(4);
    }

    @Test
    void missingMonthsAreFilledWithZeroColumns() {
        List<EnrichedIssue> gappy = List.of(
                enriched("INT-1", "2023-11", "Slack"),
                enriched("INT-2", "2024-02", "Slack"));

        AggregationTable table = aggregator.aggregate(
                new TableSpec(CategoryDimension.INTEGRATION_APP, BucketDimension.MONTH), gappy);

        assertThat(table.getBuckets()).containsExactly("2023-11", "2023-12", "2024-01", "2024-02");
        assertThat(table.row("Slack")).containsExactly(1, 0, 0, 1);
    }

    @Test
    void blankCategoriesAreCountedAsUnknown() {
        AggregationTable table = aggregator.aggregate(
                new TableSpec(CategoryDimension.PRIORITY, BucketDimension.QUARTER), issues);

        assertThat(table.getCategories()).containsExactly(EnrichedIssue.UNKNOWN);
        assertThat(table.getBuckets()).containsExactly("2024-Q1");
        assertThat(table.rowTotal(EnrichedIssue.UNKNOWN)).isEqualTo(issues.size());
        assertThat(table.percentageOf(EnrichedIssue.UNKNOWN)).isEqualByComparingTo("100");
    }

    @Test
    void holidayPeriodAxisListsEveryPeriodInCalendarOrder() {
        AggregationTable table = aggregator.aggregate(
                new TableSpec(CategoryDimension.INTEGRATION_APP, BucketDimension.HOLIDAY_PERIOD), issues);

        assertThat(table.getBuckets()).containsExactly("Black Friday Week", "Cyber Monday", "Holiday Shopping",
                "Christmas Week", "New Year Recovery", "Off-Season");
        assertThat(table.getColumnTotals()).containsEntry("Off-Season", issues.size())
                .containsEntry("Cyber Monday", 0);
    }

    @Test
    void emptyInputYieldsEmptyTable() {
        AggregationTable table = aggregator.aggregate(
                new TableSpec(CategoryDimension.CUSTOMER, BucketDimension.MONTH), List.of());

        assertThat(table.getCategories()).isEmpty();
        assertThat(table.getBuckets()).isEmpty();
        assertThat(table.getGrandTotal()).isZero();
        assertThat(table.topCategories(5)).isEmpty();
    }

    @Test
    void rejectsCountsOutsideTheColumnAxis() {
        assertThatThrownBy(() -> AggregationTable.of("t", "c", "b", List.of("2024-01"),
                java.util.Map.of("Slack", java.util.Map.of("2024-02", 1))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("2024-02");
    }
}
