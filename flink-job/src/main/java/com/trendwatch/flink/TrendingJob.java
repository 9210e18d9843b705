package com.trendwatch.flink;

import com.trendwatch.core.config.TrendingConfig;
import com.trendwatch.core.config.TrendingConfigLoader;
import com.trendwatch.core.engine.CycleReport;
import com.trendwatch.core.model.HistogramBatch;
import com.esotericsoftware.kryo.Serializer;
import com.trendwatch.core.trend.TrendRegistry;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.java.typeutils.runtime.kryo.JavaSerializer;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Main entry point of the trending Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (histograms topic)
 *     → Deserialize JSON → HistogramBatch
 *     → Key by subsystem
 *     → TrendProcessFunction (extract → buffer → render → commit)
 *     → Serialize CycleReport → JSON
 *     → Kafka (trend-updates topic)
 * </pre>
 *
 * <h3>Checkpointing</h3>
 * <p>
 * Exactly-once checkpointing keeps the keyed trend registries consistent
 * with the consumed offsets after a failure.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrendingJob {

        private static final Logger LOG = LoggerFactory.getLogger(TrendingJob.class);

        private TrendingJob() {
                // not instantiable
        }

        public static void main(String[] args) throws Exception {
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Trend Watch with config: {}", config);

                TrendingConfig trendingConfig = TrendingConfigLoader.load(config.getTrendingConfigPath());
                if (trendingConfig.getSubsystems().isEmpty()) {
                        throw new IllegalStateException(
                                        "No trending subsystems defined. Provide them via "
                                                        + TrendingConfigLoader.ENV_CONFIG_PATH
                                                        + " or a classpath trending.yml file.");
                }

                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                buildPipeline(env, config, trendingConfig);

                env.execute("Trend Watch – Histogram Trending");
        }

        /**
         * Build the Kafka → Flink → Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        TrendingConfig trendingConfig) {
                // registry state holds immutable JDK collections that Kryo cannot rebuild
                env.getConfig().addDefaultKryoSerializer(TrendRegistry.class,
                                (Class<? extends Serializer<?>>) (Class<?>) JavaSerializer.class);

                KafkaSource<HistogramBatch> source = KafkaSource.<HistogramBatch>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaHistogramTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new HistogramBatchDeserializationSchema())
                                .build();

                DataStream<HistogramBatch> batches = env.fromSource(
                                source, WatermarkStrategy.noWatermarks(), "kafka-histogram-source");

                DataStream<CycleReport> reports = batches
                                .filter(Objects::nonNull) // drop deserialization failures
                                .keyBy(HistogramBatch::getSubsystem)
                                .process(new TrendProcessFunction(trendingConfig))
                                .name("trend-cycles");

                KafkaSink<CycleReport> sink = KafkaSink.<CycleReport>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.builder()
                                                                .setTopic(config.getKafkaReportTopic())
                                                                .setValueSerializationSchema(
                                                                                new CycleReportSerializationSchema())
                                                                .build())
                                .build();

                reports.sinkTo(sink).name("kafka-report-sink");
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}
