package org.rostilos.reviewpipe.analysisengine.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.rostilos.reviewpipe.core.model.report.Report;

import java.io.UncheckedIOException;

public class JsonReportRenderer implements ReportRenderer {

    public static final String FORMAT = "json";

    private final ObjectMapper objectMapper;

    public JsonReportRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public String render(Report report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize report", e);
        }
    }

    @Override
    public String getFormat() {
        return FORMAT;
    }

    @Override
    public String getFileExtension() {
        return ".json";
    }
}
