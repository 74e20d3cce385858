package com.z254.insight.prism.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.z254.insight.prism.domain.model.PipelineResult;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link PipelineResult} as indented JSON.
 * <p>
 * Output depends only on the result: map and list order come from the pipeline's
 * deterministic ordering, timestamps are ISO-8601 strings, so identical runs produce
 * byte-identical files.
 */
@Component
public class JsonReportWriter implements AnalyticsReportWriter {

    private final ObjectMapper mapper;

    public JsonReportWriter() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
        mapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
    }

    @Override
    public void write(PipelineResult result, OutputStream out) throws IOException {
        mapper.writeValue(out, result);
        out.write('\n');
        out.flush();
    }

    public void write(PipelineResult result, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(target)) {
            write(result, out);
        }
    }

    public String writeAsString(PipelineResult result) throws IOException {
        return mapper.writeValueAsString(result);
    }
}
