package com.z254.insight.prism.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Structured logging for PRISM pipeline runs.
 * <p>
 * Provides consistent, machine-readable log output with:
 * <ul>
 *     <li>MDC context for the run id and the current stage</li>
 *     <li>Run and record lifecycle events</li>
 *     <li>Stage timing</li>
 * </ul>
 */
@Slf4j
@Component
public class PrismStructuredLogger {

    // MDC keys
    public static final String MDC_RUN_ID = "runId";
    public static final String MDC_STAGE = "stage";
    public static final String MDC_SOURCE = "source";

    private static final long SLOW_STAGE_MILLIS = 5000;

    /**
     * Log a run lifecycle event with details.
     */
    public void logRunEvent(String runId, RunEventType eventType, String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_RUN_ID, runId))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("runId", runId);
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case FAILED, REJECTED -> log.error("{} | data={}", message, formatLogData(logData));
                case PARTIAL_FAILURE -> log.warn("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log what happened to a single input record.
     */
    public void logRecordEvent(int recordIndex, String recordId, RecordEventType eventType, String message) {
        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("event", eventType.name());
        logData.put("recordIndex", recordIndex);
        if (recordId != null) {
            logData.put("recordId", recordId);
        }

        switch (eventType) {
            case REJECTED, FIELD_DROPPED -> log.warn("{} | data={}", message, formatLogData(logData));
            default -> log.debug("{} | data={}", message, formatLogData(logData));
        }
    }

    /**
     * Log a stage timing.
     */
    public void logPerformance(String operation, Duration duration, boolean success, Map<String, Object> details) {
        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("event", "PERFORMANCE");
        logData.put("operation", operation);
        logData.put("durationMs", duration.toMillis());
        logData.put("success", success);
        if (details != null) {
            logData.putAll(details);
        }

        if (duration.toMillis() > SLOW_STAGE_MILLIS) {
            log.warn("Slow stage: {} took {}ms | data={}", operation, duration.toMillis(), formatLogData(logData));
        } else {
            log.debug("Stage {} completed in {}ms | data={}", operation, duration.toMillis(), formatLogData(logData));
        }
    }

    /**
     * Run one stage with the stage name in MDC and log its duration.
     */
    public <T> T timed(String operation, Supplier<T> action) {
        Instant start = Instant.now();
        boolean success = false;
        try (var scope = withContext(Map.of(MDC_STAGE, operation))) {
            T result = action.get();
            success = true;
            return result;
        } finally {
            logPerformance(operation, Duration.between(start, Instant.now()), success, null);
        }
    }

    public MDCScope withContext(Map<String, String> context) {
        MDCScope scope = new MDCScope(context.keySet().toArray(new String[0]));
        context.forEach(MDC::put);
        return scope;
    }

    public MDCScope withRunId(String runId) {
        MDCScope scope = new MDCScope(MDC_RUN_ID);
        MDC.put(MDC_RUN_ID, runId);
        return scope;
    }

    private String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    // ========== Event Type Enums ==========

    public enum RunEventType {
        STARTED, NORMALIZED, PARTIAL_FAILURE, ENRICHED, AGGREGATED, COMPLETED, REJECTED, FAILED
    }

    public enum RecordEventType {
        REJECTED, FIELD_DROPPED, OUT_OF_SCOPE
    }

    /**
     * Auto-closeable MDC scope. Captures the values of its keys when opened and puts them
     * back on close, so scopes nest.
     */
    public static class MDCScope implements AutoCloseable {
        private final Map<String, String> previous = new HashMap<>();

        public MDCScope(String... keys) {
            for (String key : keys) {
                previous.put(key, MDC.get(key));
            }
        }

        @Override
        public void close() {
            previous.forEach((key, value) -> {
                if (value == null) {
                    MDC.remove(key);
                } else {
                    MDC.put(key, value);
                }
            });
        }
    }
}
