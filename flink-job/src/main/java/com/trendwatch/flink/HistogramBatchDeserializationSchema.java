package com.trendwatch.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trendwatch.core.model.HistogramBatch;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;

/**
 * Converts raw Kafka bytes into a {@link HistogramBatch}.
 * <p>
 * Malformed messages and batches without a subsystem are logged and dropped
 * (returns {@code null}), so a single bad record cannot stop the job.
 * </p>
 */
public class HistogramBatchDeserializationSchema implements DeserializationSchema<HistogramBatch> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(HistogramBatchDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public HistogramBatch deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            HistogramBatch batch = objectMapper().readValue(message, HistogramBatch.class);
            if (batch.getSubsystem() == null || batch.getSubsystem().isBlank()) {
                LOG.warn("Histogram batch without subsystem – skipping");
                return null;
            }
            if (batch.getCreatedAt() == null) {
                batch.setCreatedAt(Instant.now());
            }
            return batch;
        } catch (Exception e) {
            LOG.warn("Failed to deserialize histogram batch – skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(HistogramBatch nextElement) {
        return false; // unbounded stream
    }

    @Override
    public TypeInformation<HistogramBatch> getProducedType() {
        return TypeInformation.of(HistogramBatch.class);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }
        return mapper;
    }
}
