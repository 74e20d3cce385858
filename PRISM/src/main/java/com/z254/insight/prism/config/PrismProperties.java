package com.z254.insight.prism.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.LocalDate;
import java.util.*;

/**
 * Configuration properties for the PRISM pipeline.
 * <p>
 * Groups:
 * <ul>
 *     <li>Pipeline scope, capacity and requested tables</li>
 *     <li>Field aliases and accepted date formats for normalization</li>
 *     <li>Ordered extraction rules (integration apps, customers, root causes)</li>
 *     <li>Holiday ranges in priority order</li>
 *     <li>Trend and anomaly thresholds</li>
 * </ul>
 * Every list is ordered: the first entry has the highest priority.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "prism")
public class PrismProperties {

    @Valid
    private final Pipeline pipeline = new Pipeline();
    @Valid
    private final Normalization normalization = new Normalization();
    @Valid
    private final Extraction extraction = new Extraction();
    @Valid
    private final Holiday holiday = new Holiday();
    @Valid
    private final Trend trend = new Trend();
    @Valid
    private final Anomaly anomaly = new Anomaly();

    /**
     * Run-level settings.
     */
    @Data
    public static class Pipeline {
        /** Hard ceiling on the batch size */
        @Positive
        private int maxRecords = 50_000;

        /** Normalize and enrich records on a parallel stream */
        private boolean parallel = false;

        /** Zone used for calendar fields and for timestamps without an offset */
        @NotBlank
        private String zone = "UTC";

        /** Length of the top-N rankings */
        @Positive
        private int topN = 10;

        /** Issues created more than this many months away from the batch's median month are rejected */
        @Positive
        private int maxMonthSpan = 120;

        /** Inclusive analysis window on the creation date; open when unset */
        private LocalDate startDate;
        private LocalDate endDate;

        /** Only keep issues whose id starts with {@code <projectKey>-} */
        private String projectKey;

        @NotEmpty
        private List<TableRequest> tables = new ArrayList<>(List.of(
                new TableRequest("INTEGRATION_APP", "MONTH"),
                new TableRequest("RESOLUTION", "MONTH"),
                new TableRequest("ROOT_CAUSE", "MONTH"),
                new TableRequest("CUSTOMER", "MONTH"),
                new TableRequest("HOLIDAY_PERIOD", "MONTH"),
                new TableRequest("PRIORITY", "QUARTER"),
                new TableRequest("INTEGRATION_APP", "HOLIDAY_PERIOD")
        ));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TableRequest {
        private String category;
        private String bucket;
    }

    /**
     * Record normalization.
     */
    @Data
    public static class Normalization {
        /** Accepted date patterns, tried in order; ISO-8601 with offset is always tried first */
        @NotEmpty
        private List<String> dateFormats = new ArrayList<>(List.of(
                "yyyy-MM-dd'T'HH:mm:ss.SSSZ",
                "yyyy-MM-dd HH:mm:ss",
                "yyyy-MM-dd HH:mm",
                "yyyy-MM-dd",
                "dd/MMM/yy h:mm a"
        ));

        /** Canonical field to accepted source names */
        @NotEmpty
        private Map<String, List<String>> fieldAliases = defaultFieldAliases();

        private static Map<String, List<String>> defaultFieldAliases() {
            Map<String, List<String>> aliases = new LinkedHashMap<>();
            aliases.put("id", new ArrayList<>(List.of("id", "key", "Issue Key", "JIRA ID")));
            aliases.put("summary", new ArrayList<>(List.of("summary", "JIRA Text", "JIRA Text/Summary", "Title")));
            aliases.put("description", new ArrayList<>(List.of("description", "Details")));
            aliases.put("status", new ArrayList<>(List.of("status", "State")));
            aliases.put("priority", new ArrayList<>(List.of("priority", "Severity")));
            aliases.put("issue-type", new ArrayList<>(List.of("issuetype", "Issue Type", "type")));
            aliases.put("resolution", new ArrayList<>(List.of("resolution", "Resolution Type")));
            aliases.put("root-cause", new ArrayList<>(List.of("Root Cause", "rootCause")));
            aliases.put("assignee", new ArrayList<>(List.of("assignee", "Assigned To")));
            aliases.put("reporter", new ArrayList<>(List.of("reporter", "Created By")));
            aliases.put("created-at", new ArrayList<>(List.of("created", "Created Date", "createdAt")));
            aliases.put("updated-at", new ArrayList<>(List.of("updated", "Updated Date", "updatedAt")));
            aliases.put("resolved-at", new ArrayList<>(List.of("resolved", "Resolved Date", "resolutiondate", "resolvedAt")));
            return aliases;
        }
    }

    /**
     * Free-text extraction rules.
     */
    @Data
    public static class Extraction {
        /** Known integration applications, most specific first */
        @NotEmpty
        @Valid
        private List<AppPattern> appPatterns = new ArrayList<>(List.of(
                new AppPattern("SAP Business ByDesign", "sap\\s+business\\s+by\\s*design|\\bbydesign\\b"),
                new AppPattern("NetSuite IA", "\\bnetsuite(?:\\s+ia)?\\b"),
                new AppPattern("Salesforce", null),
                new AppPattern("HubSpot", null),
                new AppPattern("Zendesk", null),
                new AppPattern("Shopify", null),
                new AppPattern("Microsoft Teams", "\\bms\\s+teams\\b|\\bmicrosoft\\s+teams\\b"),
                new AppPattern("Slack", null),
                new AppPattern("Zoom", null),
                new AppPattern("Google Workspace", "\\bg\\s*suite\\b|\\bgoogle\\s+workspace\\b"),
                new AppPattern("ServiceNow", null),
                new AppPattern("Jira", null),
                new AppPattern("Confluence", null),
                new AppPattern("Trello", null),
                new AppPattern("Asana", null),
                new AppPattern("Monday.com", null),
                new AppPattern("AWS", null),
                new AppPattern("Azure", null)
        ));

        /** Customer rules in decreasing confidence */
        @NotEmpty
        @Valid
        private List<CustomerPattern> customerPatterns = new ArrayList<>(List.of(
                new CustomerPattern("explicit-marker", "HIGH", "MARKER",
                        new ArrayList<>(List.of("customer", "account", "client", "company", "organization")), null),
                new CustomerPattern("trigger-phrase", "MEDIUM", "TRIGGER",
                        new ArrayList<>(List.of("for", "client", "customer")), null),
                new CustomerPattern("capitalized-token", "LOW", "CAPITALIZED_TOKEN", new ArrayList<>(), null)
        ));

        /** Values that never count as a customer name */
        private List<String> customerStopValues = new ArrayList<>(List.of(
                "none", "unknown", "n/a", "na", "tbd", "to be determined", "internal", "test",
                "demo", "sample", "example", "customer", "client", "account", "user"
        ));

        /** Common ticket words that cannot make up a customer name on their own */
        private List<String> customerExcludedTerms = new ArrayList<>(List.of(
                "a", "an", "the", "this", "that", "these", "after", "before", "during", "when", "while",
                "please", "urgent", "help", "question", "request", "issue", "issues", "error", "errors",
                "bug", "failure", "failed", "failing", "fails", "unable", "cannot", "can't", "not",
                "sync", "syncing", "synced", "integration", "connector", "flow", "flows", "webhook",
                "api", "token", "order", "orders", "invoice", "invoices", "payment", "payments",
                "item", "items", "inventory", "field", "fields", "mapping", "data", "record", "records",
                "update", "updates", "new", "missing", "duplicate", "import", "export", "timeout",
                "customer", "customers", "client", "account", "accounts", "company", "user", "users",
                "sales", "purchase", "return", "refund", "refunds", "shipment", "fulfillment", "status",
                "production", "sandbox", "prod", "environment", "setup", "configuration", "config",
                "january", "february", "march", "april", "may", "june", "july", "august", "september",
                "october", "november", "december", "monday", "tuesday", "wednesday", "thursday",
                "friday", "saturday", "sunday", "black", "cyber", "christmas", "holiday", "q1", "q2",
                "q3", "q4", "i", "we", "our", "it", "is", "are", "was", "were", "has", "have", "on",
                "in", "of", "to", "and", "or", "with", "from", "via", "by", "at", "all", "some", "no"
        ));

        /** Root-cause keyword rules, first match wins */
        @NotEmpty
        @Valid
        private List<KeywordRule> rootCauseRules = new ArrayList<>(List.of(
                new KeywordRule("Holiday Season Volume", List.of("holiday", "peak", "high volume", "increased load", "seasonal")),
                new KeywordRule("Configuration Error", List.of("configuration", "setup", "config", "not configured", "misconfigured")),
                new KeywordRule("API Limitations", List.of("api", "rate limit", "rate limited", "quota", "endpoint", "request failed")),
                new KeywordRule("Authentication Failure", List.of("authentication", "auth", "token", "credential", "credentials", "unauthorized", "401", "403")),
                new KeywordRule("Data Mapping Issue", List.of("mapping", "field", "invalid field", "missing field", "field mapping")),
                new KeywordRule("Data Synchronization Problem", List.of("sync", "synchronization", "not syncing", "sync error", "sync failed")),
                new KeywordRule("Performance Issue", List.of("performance", "slow", "timeout", "delay", "lag", "bottleneck")),
                new KeywordRule("Data Validation Error", List.of("validation", "invalid", "required", "format", "data format")),
                new KeywordRule("Duplicate Data Issue", List.of("duplicate", "duplication", "duplicated", "already exists")),
                new KeywordRule("Connection Problem", List.of("connection", "connectivity", "network", "disconnect", "connection failed")),
                new KeywordRule("Code/Script Error", List.of("script", "code", "bug", "error", "exception", "crash")),
                new KeywordRule("External System Issue", List.of("external", "third party", "vendor", "partner", "system down"))
        ));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AppPattern {
        @NotBlank
        private String name;

        /** Case-insensitive regex; when blank the name itself is matched as a whole word */
        private String pattern;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CustomerPattern {
        @NotBlank
        private String name;

        /** HIGH, MEDIUM or LOW */
        @NotBlank
        private String confidence;

        /** MARKER, TRIGGER, CAPITALIZED_TOKEN or REGEX */
        @NotBlank
        private String type;

        /** Marker terms or trigger words, depending on the type */
        private List<String> terms = new ArrayList<>();

        /** For REGEX rules: a pattern whose first capturing group holds the name */
        private String regex;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class KeywordRule {
        @NotBlank
        private String name;

        @NotEmpty
        private List<String> keywords = new ArrayList<>();
    }

    /**
     * Holiday period calendar.
     */
    @Data
    public static class Holiday {
        /** Named month/day ranges ({@code MM-dd}), inclusive, evaluated in order */
        @NotEmpty
        @Valid
        private List<HolidayRange> ranges = new ArrayList<>(List.of(
                new HolidayRange("Black Friday Week", "11-20", "11-27"),
                new HolidayRange("Cyber Monday", "11-27", "12-01"),
                new HolidayRange("Holiday Shopping", "12-01", "12-24"),
                new HolidayRange("Christmas Week", "12-24", "01-01"),
                new HolidayRange("New Year Recovery", "01-01", "01-15")
        ));

        /** Period assigned when no range matches */
        @NotBlank
        private String fallbackPeriod = "Off-Season";
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HolidayRange {
        @NotBlank
        private String name;
        @NotBlank
        private String start;
        @NotBlank
        private String end;
    }

    /**
     * Trend labelling.
     */
    @Data
    public static class Trend {
        /** Relative change between the half means needed to leave STABLE */
        @DecimalMin("0.0")
        private double threshold = 0.15;

        /** Shorter series are STABLE by definition */
        @Positive
        private int minPoints = 2;
    }

    /**
     * Anomaly flagging over a trailing window.
     */
    @Data
    public static class Anomaly {
        /** Trailing window length in buckets */
        @Positive
        private int window = 3;

        /** Deviation must exceed this many standard deviations of the window */
        @DecimalMin("0.0")
        private double sensitivity = 3.0;

        /** ... and this fraction of the window mean (floored at one issue) */
        @DecimalMin("0.0")
        private double minRelativeDeviation = 0.5;

        /** Points with fewer preceding buckets are never flagged */
        @Positive
        private int minHistory = 2;
    }
}
