package com.trendwatch.flink;

import java.io.Serializable;
import java.util.Objects;

/**
 * Typed, immutable configuration of the trending Flink job.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the job
 * is configured entirely through the deployment environment. Trend
 * definitions live in the YAML file named by {@code TRENDING_CONFIG_PATH}.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String kafkaBootstrapServers;
    private final String kafkaHistogramTopic;
    private final String kafkaReportTopic;
    private final String kafkaGroupId;

    private final int parallelism;
    private final long checkpointIntervalMs;

    private final String trendingConfigPath;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaHistogramTopic = b.kafkaHistogramTopic;
        this.kafkaReportTopic = b.kafkaReportTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.trendingConfigPath = b.trendingConfigPath;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaHistogramTopic(env("KAFKA_HISTOGRAM_TOPIC", "histograms"))
                    .kafkaReportTopic(env("KAFKA_REPORT_TOPIC", "trend-updates"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "trend-watch"))
                    .parallelism(Integer.parseInt(env("FLINK_PARALLELISM", "1")))
                    .checkpointIntervalMs(Long.parseLong(env("FLINK_CHECKPOINT_INTERVAL_MS", "60000")))
                    .trendingConfigPath(env("TRENDING_CONFIG_PATH", ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaHistogramTopic() {
        return kafkaHistogramTopic;
    }

    public String getKafkaReportTopic() {
        return kafkaReportTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    /**
     * @return path of the trending YAML, or blank to use the classpath
     *         default
     */
    public String getTrendingConfigPath() {
        return trendingConfigPath;
    }

    /**
     * Fluent builder; {@link #build()} validates ranges and topic names.
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaHistogramTopic = "histograms";
        private String kafkaReportTopic = "trend-updates";
        private String kafkaGroupId = "trend-watch";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private String trendingConfigPath = "";

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaHistogramTopic(String v) {
            this.kafkaHistogramTopic = v;
            return this;
        }

        public Builder kafkaReportTopic(String v) {
            this.kafkaReportTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder trendingConfigPath(String v) {
            this.trendingConfigPath = v;
            return this;
        }

        /**
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(kafkaHistogramTopic, "kafkaHistogramTopic");
            requireNonBlank(kafkaReportTopic, "kafkaReportTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (trendingConfigPath == null) {
                trendingConfigPath = "";
            }
            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaHistogramTopic='" + kafkaHistogramTopic + '\'' +
                ", kafkaReportTopic='" + kafkaReportTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", trendingConfigPath='" + trendingConfigPath + '\'' +
                '}';
    }
}
