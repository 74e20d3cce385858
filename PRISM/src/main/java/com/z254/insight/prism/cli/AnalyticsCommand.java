package com.z254.insight.prism.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.insight.prism.config.PipelineConfiguration;
import com.z254.insight.prism.domain.model.CategoryTotal;
import com.z254.insight.prism.domain.model.NormalizationReport;
import com.z254.insight.prism.domain.model.PipelineResult;
import com.z254.insight.prism.error.ConfigurationException;
import com.z254.insight.prism.error.PrismException;
import com.z254.insight.prism.pipeline.IssueAnalyticsPipeline;
import com.z254.insight.prism.report.JsonReportWriter;
import com.z254.insight.prism.source.JsonFileIssueSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line entry: read an issue file, run the pipeline, write the JSON report.
 * <p>
 * Exit codes: {@value #EXIT_OK} on success (partial normalization failures included),
 * {@value #EXIT_FAILURE} on a systemic failure, {@value #EXIT_CONFIGURATION} on a
 * configuration error.
 */
@Slf4j
@Component
@Command(
    name = "prism",
    mixinStandardHelpOptions = true,
    version = "0.1.0",
    description = "Build issue analytics tables (volume per app, customer, root cause and holiday period) from a tracker export."
)
public class AnalyticsCommand implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_CONFIGURATION = 2;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-i", "--input"}, required = true,
        description = "JSON file: an array of records or an issue-tracker search response")
    private Path input;

    @Option(names = {"-o", "--output"},
        description = "Report file; the report goes to standard output when omitted")
    private Path output;

    @Option(names = {"--start-date"}, description = "First creation date in scope (yyyy-MM-dd)")
    private LocalDate startDate;

    @Option(names = {"--end-date"}, description = "Last creation date in scope (yyyy-MM-dd)")
    private LocalDate endDate;

    @Option(names = {"-p", "--project"}, description = "Project key; only issues KEY-* are analysed")
    private String project;

    private final IssueAnalyticsPipeline pipeline;
    private final PipelineConfiguration configuration;
    private final JsonReportWriter reportWriter;
    private final ObjectMapper mapper = new ObjectMapper();

    public AnalyticsCommand(IssueAnalyticsPipeline pipeline,
                            PipelineConfiguration configuration,
                            JsonReportWriter reportWriter) {
        this.pipeline = pipeline;
        this.configuration = configuration;
        this.reportWriter = reportWriter;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            PipelineConfiguration scoped = configuration.withScope(startDate, endDate, project);
            JsonFileIssueSource source = new JsonFileIssueSource(input, mapper);
            PipelineResult result = pipeline.run(source.fetch(), scoped);

            if (output != null) {
                reportWriter.write(result, output);
                printSummary(out, result);
                out.printf("Report written to %s%n", output);
            } else {
                out.println(reportWriter.writeAsString(result));
            }
            out.flush();
            return EXIT_OK;
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            err.printf("Configuration error: %s%n", e.getMessage());
            return EXIT_CONFIGURATION;
        } catch (PrismException e) {
            log.error("Analysis failed: {}", e.getMessage(), e);
            err.printf("Analysis failed: %s%n", e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            log.error("Failed to write report to {}", output, e);
            err.printf("Failed to write report: %s%n", e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private void printSummary(PrintWriter out, PipelineResult result) {
        NormalizationReport report = result.getNormalizationReport();
        out.printf("Records: %d received, %d normalized, %d rejected, %d out of scope%n",
                report.getRecordsReceived(), report.getRecordsNormalized(),
                report.getFailures().size(), report.getRecordsOutOfScope());
        report.getFailureCountsByReason().forEach((reason, count) ->
                out.printf("  rejected (%s): %d%n", reason, count));

        for (Map.Entry<String, List<CategoryTotal>> ranking : result.getRankings().entrySet()) {
            out.printf("%s:%n", ranking.getKey());
            for (CategoryTotal total : ranking.getValue()) {
                out.printf("  %2d. %-30s %5d  %6s%%%n",
                        total.getRank(), total.getCategory(), total.getTotal(), total.getPercentage());
            }
        }
    }
}
