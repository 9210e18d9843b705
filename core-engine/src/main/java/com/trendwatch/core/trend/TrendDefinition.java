package com.trendwatch.core.trend;

import com.trendwatch.core.metric.MetricExtractor;
import com.trendwatch.core.metric.MetricExtractors;
import com.trendwatch.core.model.AlarmRef;
import com.trendwatch.core.render.ArtifactPaths;
import com.trendwatch.core.trend.TrendValidationException.Kind;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of one trend: what it is called, which histograms
 * it depends on, which statistic it extracts and which alarms are attached
 * to it.
 *
 * <h3>Validation</h3>
 * <p>
 * Every check runs eagerly in {@link Builder#build()}; a definition that
 * exists is valid. Failures are reported as
 * {@link TrendValidationException} with a {@link Kind}:
 * </p>
 * <ul>
 * <li>{@code WRONG_TYPE} - null/blank name, description or histogram
 * name, or a name unusable in an artifact path</li>
 * <li>{@code NOT_COLLECTION} - histogram names not supplied</li>
 * <li>{@code NO_HISTOGRAMS} - histogram names empty</li>
 * <li>{@code WRONG_METRIC} - metric missing or unknown</li>
 * <li>{@code WRONG_ALARM_TYPE} - an attached element is not an
 * {@link AlarmRef}</li>
 * </ul>
 *
 * <p>
 * The first histogram name is the <em>primary</em> histogram: it is the one
 * the metric is extracted from. The others only gate processing.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrendDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final String description;
    private final List<String> histogramNames;
    private final MetricExtractor metric;
    private final List<AlarmRef> alarms;

    private TrendDefinition(String name, String description, List<String> histogramNames,
            MetricExtractor metric, List<AlarmRef> alarms) {
        this.name = name;
        this.description = description;
        this.histogramNames = histogramNames;
        this.metric = metric;
        this.alarms = alarms;
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    /**
     * Create a definition without alarms.
     *
     * @see Builder#build()
     */
    public static TrendDefinition create(String name, String description,
            Collection<String> histogramNames, String metric) throws TrendValidationException {
        return builder()
                .name(name)
                .description(description)
                .histogramNames(histogramNames)
                .metric(metric)
                .build();
    }

    /**
     * Create a definition with an explicit extractor and alarms.
     *
     * @see Builder#build()
     */
    public static TrendDefinition create(String name, String description,
            Collection<String> histogramNames, MetricExtractor metric,
            Collection<?> alarms) throws TrendValidationException {
        return builder()
                .name(name)
                .description(description)
                .histogramNames(histogramNames)
                .metric(metric)
                .attachAlarms(alarms)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link TrendDefinition}. Setters only record their
     * input; everything is checked in {@link #build()}.
     */
    public static class Builder {
        private String name;
        private String description;
        private Collection<String> histogramNames;
        private String metricName;
        private MetricExtractor metric;
        private final List<Object> alarms = new ArrayList<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder histogramNames(Collection<String> histogramNames) {
            this.histogramNames = histogramNames;
            return this;
        }

        /**
         * @param metric configuration tag, resolved by
         *               {@link MetricExtractors#forName(String)}
         */
        public Builder metric(String metric) {
            this.metricName = metric;
            this.metric = null;
            return this;
        }

        public Builder metric(MetricExtractor metric) {
            this.metric = metric;
            this.metricName = null;
            return this;
        }

        /**
         * Attach a single alarm, or every element of a collection of alarms.
         * Order is preserved.
         *
         * @param alarms an {@link AlarmRef} or a collection of them
         */
        public Builder attachAlarms(Object alarms) {
            if (alarms instanceof Collection<?> many) {
                this.alarms.addAll(many);
            } else if (alarms != null) {
                this.alarms.add(alarms);
            }
            return this;
        }

        /**
         * Validate the recorded input and build the definition.
         *
         * @return a new, valid definition
         * @throws TrendValidationException on the first invalid input
         */
        public TrendDefinition build() throws TrendValidationException {
            requireText(name, "Trend 'name'");
            if (!ArtifactPaths.isUsableName(name)) {
                throw new TrendValidationException(Kind.WRONG_TYPE,
                        "Trend name '" + name + "' contains control characters, backslashes or '.'/'..' segments");
            }
            requireText(description, "Description of trend '" + name + "'");
            List<String> histograms = validateHistograms();
            MetricExtractor extractor = resolveMetric();
            List<AlarmRef> alarmRefs = validateAlarms();
            return new TrendDefinition(name, description, histograms, extractor, alarmRefs);
        }

        private List<String> validateHistograms() throws TrendValidationException {
            if (histogramNames == null) {
                throw new TrendValidationException(Kind.NOT_COLLECTION,
                        "Trend '" + name + "' requires a collection of histogram names");
            }
            if (histogramNames.isEmpty()) {
                throw new TrendValidationException(Kind.NO_HISTOGRAMS,
                        "Trend '" + name + "' requires at least one histogram name");
            }
            for (String histogramName : histogramNames) {
                requireText(histogramName, "Histogram name of trend '" + name + "'");
            }
            return List.copyOf(histogramNames);
        }

        private MetricExtractor resolveMetric() throws TrendValidationException {
            if (metric != null) {
                return metric;
            }
            return MetricExtractors.forName(metricName)
                    .orElseThrow(() -> new TrendValidationException(Kind.WRONG_METRIC,
                            "Unknown metric '" + metricName + "' for trend '" + name
                                    + "'. Supported: " + MetricExtractors.SUPPORTED));
        }

        private List<AlarmRef> validateAlarms() throws TrendValidationException {
            List<AlarmRef> refs = new ArrayList<>(alarms.size());
            for (Object alarm : alarms) {
                if (!(alarm instanceof AlarmRef ref)) {
                    throw new TrendValidationException(Kind.WRONG_ALARM_TYPE,
                            "Trend '" + name + "' cannot attach " + alarm + " as an alarm");
                }
                refs.add(ref);
            }
            return List.copyOf(refs);
        }

        private static void requireText(String value, String what) throws TrendValidationException {
            if (value == null || value.isBlank()) {
                throw new TrendValidationException(Kind.WRONG_TYPE, what + " must be a non-blank string");
            }
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return unmodifiable, non-empty list of required histogram names
     */
    public List<String> getHistogramNames() {
        return histogramNames;
    }

    /**
     * @return the histogram the metric is extracted from
     */
    public String getPrimaryHistogramName() {
        return histogramNames.get(0);
    }

    public MetricExtractor getMetric() {
        return metric;
    }

    /**
     * @return unmodifiable list of attached alarms, in attachment order
     */
    public List<AlarmRef> getAlarms() {
        return alarms;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TrendDefinition that))
            return false;
        return name.equals(that.name)
                && description.equals(that.description)
                && histogramNames.equals(that.histogramNames)
                && metric.getName().equals(that.metric.getName())
                && alarms.equals(that.alarms);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, histogramNames, metric.getName());
    }

    @Override
    public String toString() {
        return "TrendDefinition{" +
                "name='" + name + '\'' +
                ", metric=" + metric.getName() +
                ", histograms=" + histogramNames +
                ", alarms=" + alarms +
                '}';
    }
}
