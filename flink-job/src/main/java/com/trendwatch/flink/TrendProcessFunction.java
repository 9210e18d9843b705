package com.trendwatch.flink;

import com.trendwatch.core.config.TrendingConfig;
import com.trendwatch.core.engine.CycleReport;
import com.trendwatch.core.engine.TrendCycleRunner;
import com.trendwatch.core.model.HistogramBatch;
import com.trendwatch.core.render.ChartArtifactRenderer;
import com.trendwatch.core.render.FileSystemArtifactSink;
import com.trendwatch.core.store.FileTrendStore;
import com.trendwatch.core.store.TrendStore;
import com.trendwatch.core.trend.TrendDefinition;
import com.trendwatch.core.trend.TrendRegistry;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Keyed process function that runs one trending cycle per histogram batch.
 *
 * <p>
 * The stream is keyed by subsystem name. Each key's {@link TrendRegistry}
 * lives in Flink managed keyed state, so it is checkpointed with the job.
 * Flink hands one element per key to the function at a time, which is what
 * keeps the cycles of a subsystem strictly sequential.
 * </p>
 *
 * <h3>State initialisation</h3>
 * <p>
 * On the first batch of a subsystem the registry is built from the trending
 * configuration and restored from the {@link TrendStore} when a committed
 * record exists.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendProcessFunction
        extends KeyedProcessFunction<String, HistogramBatch, CycleReport> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(TrendProcessFunction.class);

    private final TrendingConfig config;

    private transient ValueState<TrendRegistry> registryState;
    private transient TrendStore store;
    private transient TrendCycleRunner runner;
    private transient TrendingMetrics metrics;

    /**
     * @param config validated trending configuration; must not be
     *               {@code null}
     */
    public TrendProcessFunction(TrendingConfig config) {
        this.config = Objects.requireNonNull(config, "TrendingConfig must not be null");
    }

    @Override
    public void open(Configuration parameters) {
        ValueStateDescriptor<TrendRegistry> descriptor = new ValueStateDescriptor<>(
                "trend-registry", TypeInformation.of(TrendRegistry.class));
        registryState = getRuntimeContext().getState(descriptor);

        store = new FileTrendStore(Path.of(config.getStorePath()));
        runner = new TrendCycleRunner(new ChartArtifactRenderer(), new FileSystemArtifactSink(), store);
        metrics = new TrendingMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("TrendProcessFunction opened for {} subsystem(s)", config.getSubsystems().size());
    }

    @Override
    public void processElement(HistogramBatch batch,
            KeyedProcessFunction<String, HistogramBatch, CycleReport>.Context ctx,
            Collector<CycleReport> out) throws Exception {
        long startNanos = System.nanoTime();
        String subsystem = ctx.getCurrentKey();

        TrendRegistry registry = registryState.value();
        if (registry == null) {
            List<TrendDefinition> definitions = config.definitionsFor(subsystem);
            if (definitions.isEmpty()) {
                LOG.debug("Subsystem [{}] has no configured trends – dropping batch", subsystem);
                return;
            }
            registry = TrendRegistry.createFrom(definitions, subsystem, config.toParameters());
            store.load(subsystem).ifPresent(registry::restore);
        }

        CycleReport report = runner.run(registry, batch.getHistograms());

        // the registry mutated in place; write it back so the checkpoint sees it
        registryState.update(registry);
        out.collect(report);

        metrics.record(report, (System.nanoTime() - startNanos) / 1_000_000);
    }
}
