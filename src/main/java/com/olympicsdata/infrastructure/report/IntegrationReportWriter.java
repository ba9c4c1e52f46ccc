package com.olympicsdata.infrastructure.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.olympicsdata.domain.model.IntegrationReport;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;

/**
 * Serializes the run report to JSON.
 */
@Component
public class IntegrationReportWriter {

    private static final ObjectMapper OBJECT_MAPPER;

    static {
        OBJECT_MAPPER = new ObjectMapper();
        OBJECT_MAPPER.registerModule(new JavaTimeModule());
        OBJECT_MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        OBJECT_MAPPER.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(IntegrationReport report, Writer writer) throws IOException {
        OBJECT_MAPPER.writeValue(writer, report);
    }

    public String toJson(IntegrationReport report) throws IOException {
        return OBJECT_MAPPER.writeValueAsString(report);
    }
}
