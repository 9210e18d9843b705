package com.trendwatch.flink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trendwatch.core.engine.CycleReport;
import org.apache.flink.api.common.serialization.SerializationSchema;

/**
 * Converts {@link CycleReport} to JSON bytes for the trend-updates topic.
 */
public class CycleReportSerializationSchema implements SerializationSchema<CycleReport> {

    private static final long serialVersionUID = 1L;

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(CycleReport report) {
        try {
            return objectMapper().writeValueAsBytes(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(
                    "Failed to serialize cycle report of subsystem '" + report.getSubsystem() + "'", e);
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        }
        return mapper;
    }
}
