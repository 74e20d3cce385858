package com.z254.insight.prism.aggregate;

import com.z254.insight.prism.config.PipelineConfiguration;
import com.z254.insight.prism.domain.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.z254.insight.prism.IssueFixtures.enriched;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class SummaryCalculatorTest {

    private SummaryCalculator calculator;
    private IssueAggregator aggregator;

    @BeforeEach
    void setUp() {
        PipelineConfiguration configuration = PipelineConfiguration.defaults();
        calculator = new SummaryCalculator(configuration.getHolidayCalendar());
        aggregator = new IssueAggregator(configuration.getHolidayCalendar());
    }

    @Test
    void overallSummaryUsesResolvedIssuesOnly() {
        List<EnrichedIssue> issues = List.of(
                enriched("INT-1", "2024-01", "Slack", Duration.ofDays(1)),
                enriched("INT-2", "2024-01", "Slack", Duration.ofDays(3)),
                enriched("INT-3", "2024-02", "Zoom", Duration.ofHours(12)),
                enriched("INT-4", "2024-02", "Zoom"));

        ResolutionSummary overall = calculator.summarize(issues, List.of()).getOverall();

        assertThat(overall.getLabel()).isEqualTo("overall");
        assertThat(overall.getTotalIssues()).isEqualTo(4);
        assertThat(overall.getResolvedIssues()).isEqualTo(3);
        assertThat(overall.getResolutionRate()).isEqualByComparingTo("75.00");
        assertThat(overall.getAverageResolutionDays()).isEqualByComparingTo("1.50");
        assertThat(overall.getMedianResolutionDays()).isEqualByComparingTo("1.00");
    }

    @Test
    void unresolvedGroupHasNoAverages() {
        ResolutionSummary summary = calculator.summarize("open",
                List.of(enriched("INT-1", "2024-01", "Slack")), issue -> true);

        assertThat(summary.getResolutionRate()).isEqualByComparingTo("0");
        assertThat(summary.getAverageResolutionDays()).isNull();
        assertThat(summary.getMedianResolutionDays()).isNull();
    }

    @Test
    void monthlyAndCategoryBreakdownsFollowTables() {
        List<EnrichedIssue> issues = List.of(
                enriched("INT-1", "2024-01", "Zoom", Duration.ofDays(2)),
                enriched("INT-2", "2024-03", "Slack"),
                enriched("INT-3", "2024-03", "Slack", Duration.ofDays(4)));
        AggregationTable table = aggregator.aggregate(
                new TableSpec(CategoryDimension.INTEGRATION_APP, BucketDimension.MONTH), issues);

        AnalyticsSummary summary = calculator.summarize(issues, List.of(table));

        assertThat(summary.getMonthly()).extracting(ResolutionSummary::getLabel)
                .containsExactly("2024-01", "2024-02", "2024-03");
        assertThat(summary.getMonthly().get(1).getTotalIssues()).isZero();
        assertThat(summary.getByCategory()).containsOnlyKeys("integration_app");
        List<ResolutionSummary> apps = summary.getByCategory().get("integration_app");
        assertThat(apps).extracting(ResolutionSummary::getLabel).containsExactly("Slack", "Zoom");
        assertThat(apps.get(0).getResolutionRate()).isEqualByComparingTo("50.00");
    }

    @Test
    void holidaySeasonComparesAgainstOffSeason() {
        EnrichedIssue cyber = enriched("INT-1", "2024-11", "Shopify", Duration.ofDays(2)).toBuilder()
                .holidayPeriod("Cyber Monday")
                .holidaySeason(true)
                .build();
        List<EnrichedIssue> issues = List.of(cyber,
                enriched("INT-2", "2024-07", "Shopify", Duration.ofDays(1)),
                enriched("INT-3", "2024-08", "Shopify"),
                enriched("INT-4", "2024-09", "Shopify"));

        HolidaySeasonSummary season = calculator.holidaySeason(issues);

        assertThat(season.getHolidaySeasonIssues()).isEqualTo(1);
        assertThat(season.getOffSeasonIssues()).isEqualTo(3);
        assertThat(season.getHolidaySeasonPercentage()).isEqualByComparingTo("25.00");
        assertThat(season.getPeriodCounts()).containsEntry("Cyber Monday", 1)
                .containsEntry("Black Friday Week", 0)
                .containsEntry("Off-Season", 3);
        assertThat(season.getHolidaySeason().getAverageResolutionDays()).isEqualByComparingTo("2.00");
        assertThat(season.getOffSeason().getLabel()).isEqualTo("Off-Season");
        assertThat(season.getOffSeason().getResolutionRate()).isEqualByComparingTo("33.33");
    }

    @Test
    void summarizesLargeBatchWithDistinctCategoriesQuickly() {
        List<EnrichedIssue> issues = new ArrayList<>();
        for (int i = 0; i < 20_000; i++) {
            issues.add(enriched("INT-" + i, "2024-0" + (i % 9 + 1), "Slack", Duration.ofHours(i % 48))
                    .toBuilder()
                    .customer("C" + i)
                    .build());
        }
        AggregationTable customers = aggregator.aggregate(
                new TableSpec(CategoryDimension.CUSTOMER, BucketDimension.MONTH), issues);

        AnalyticsSummary summary = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> calculator.summarize(issues, List.of(customers)));

        assertThat(summary.getByCategory().get("customer")).hasSize(20_000)
                .allSatisfy(row -> assertThat(row.getTotalIssues()).isEqualTo(1));
        assertThat(summary.getMonthly()).hasSize(9);
        assertThat(summary.getMonthly().stream().mapToInt(ResolutionSummary::getTotalIssues).sum())
                .isEqualTo(20_000);
    }

    @Test
    void percentageIsZeroForEmptyWhole() {
        assertThat(SummaryCalculator.percentage(0, 0)).isEqualByComparingTo("0");
        assertThat(SummaryCalculator.percentage(2, 3)).isEqualByComparingTo("66.67");
    }
}
