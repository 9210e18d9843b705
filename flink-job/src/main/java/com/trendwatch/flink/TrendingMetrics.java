package com.trendwatch.flink;

import com.trendwatch.core.engine.CycleReport;
import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Flink metrics of the trending job, exposed through the cluster's
 * configured reporters.
 *
 * <ul>
 *   <li>{@code cycles_total} – histogram batches processed</li>
 *   <li>{@code samples_appended_total} – samples added to trend buffers</li>
 *   <li>{@code extraction_failures_total} – per-trend extraction failures</li>
 *   <li>{@code render_failures_total} – per-trend render failures</li>
 *   <li>{@code commit_failures_total} – cycles whose commit failed</li>
 *   <li>{@code cycle_latency_ms} – wall time of a cycle</li>
 * </ul>
 */
public class TrendingMetrics {

    private final Counter cycles;
    private final Counter samplesAppended;
    private final Counter extractionFailures;
    private final Counter renderFailures;
    private final Counter commitFailures;
    private final Histogram cycleLatency;

    public TrendingMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup("trend_watch");

        this.cycles = group.counter("cycles_total");
        this.samplesAppended = group.counter("samples_appended_total");
        this.extractionFailures = group.counter("extraction_failures_total");
        this.renderFailures = group.counter("render_failures_total");
        this.commitFailures = group.counter("commit_failures_total");
        this.cycleLatency = group.histogram("cycle_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void record(CycleReport report, long latencyMs) {
        cycles.inc();
        samplesAppended.inc(report.getUpdated().size());
        extractionFailures.inc(report.getExtractionFailures().size());
        renderFailures.inc(report.getRenderFailures().size());
        if (!report.isCommitted() && !report.isCancelled()) {
            commitFailures.inc();
        }
        cycleLatency.update(latencyMs);
    }
}
