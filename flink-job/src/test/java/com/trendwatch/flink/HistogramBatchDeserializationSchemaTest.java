package com.trendwatch.flink;

import com.trendwatch.core.model.HistogramBatch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link HistogramBatchDeserializationSchema}.
 */
class HistogramBatchDeserializationSchemaTest {

    private final HistogramBatchDeserializationSchema schema = new HistogramBatchDeserializationSchema();

    @Test
    @DisplayName("Should deserialize a histogram batch")
    void shouldDeserializeBatch() throws Exception {
        String json = "{\"subsystem\":\"tracker\",\"createdAt\":\"2024-03-01T10:00:00Z\","
                + "\"histograms\":{\"hits\":{\"name\":\"hits\",\"lowEdge\":0,\"highEdge\":2,\"contents\":[1,3]}},"
                + "\"producer\":\"ignored\"}";

        HistogramBatch batch = schema.deserialize(bytes(json));

        assertThat(batch.getSubsystem()).isEqualTo("tracker");
        assertThat(batch.getCreatedAt()).isEqualTo(Instant.parse("2024-03-01T10:00:00Z"));
        assertThat(batch.getHistograms()).containsOnlyKeys("hits");
        assertThat(batch.getHistograms().get("hits").getEntries()).isEqualTo(4.0);
    }

    @Test
    @DisplayName("Should stamp batches without a creation time")
    void shouldStampMissingTimestamp() throws Exception {
        HistogramBatch batch = schema.deserialize(bytes("{\"subsystem\":\"tracker\",\"histograms\":{}}"));

        assertThat(batch.getCreatedAt()).isNotNull();
    }

    @Test
    @DisplayName("Should drop malformed and incomplete messages")
    void shouldDropBadMessages() throws Exception {
        assertThat(schema.deserialize(bytes("{ not json"))).isNull();
        assertThat(schema.deserialize(bytes("{\"histograms\":{}}"))).isNull();
        assertThat(schema.deserialize(bytes("{\"subsystem\":\"t\",\"histograms\":{\"h\":"
                + "{\"name\":\"h\",\"lowEdge\":1,\"highEdge\":0,\"contents\":[1]}}}"))).isNull();
        assertThat(schema.deserialize(new byte[0])).isNull();
        assertThat(schema.deserialize(null)).isNull();
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
