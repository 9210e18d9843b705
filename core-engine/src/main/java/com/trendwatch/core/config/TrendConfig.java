package com.trendwatch.core.config;

import com.trendwatch.core.model.AlarmRef;
import com.trendwatch.core.trend.TrendDefinition;
import com.trendwatch.core.trend.TrendValidationException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One trend entry of the YAML configuration.
 *
 * <pre>
 * - name: EMCTRQA_ampMean
 *   description: Mean amplitude
 *   metric: mean
 *   histograms: [EMCTRQA_histAmp]
 *   alarms: [ampAbsolute]
 * </pre>
 *
 * <p>
 * Nothing is checked while the YAML is bound; {@link #toDefinition()} runs
 * the full {@link TrendDefinition} validation.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private String name;
    private String description;
    private String metric;
    private List<String> histograms;
    private List<String> alarms = new ArrayList<>();

    /**
     * Build the validated definition described by this entry.
     *
     * @return the trend definition
     * @throws TrendValidationException if the entry is invalid
     */
    public TrendDefinition toDefinition() throws TrendValidationException {
        List<Object> alarmRefs = new ArrayList<>();
        for (String alarm : alarms) {
            // blank names fall through as-is and are rejected as WRONG_ALARM_TYPE
            alarmRefs.add(alarm != null && !alarm.isBlank() ? AlarmRef.of(alarm) : alarm);
        }
        return TrendDefinition.builder()
                .name(name)
                .description(description)
                .histogramNames(histograms)
                .metric(metric)
                .attachAlarms(alarmRefs)
                .build();
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    public List<String> getHistograms() {
        return histograms;
    }

    public void setHistograms(List<String> histograms) {
        this.histograms = histograms != null ? new ArrayList<>(histograms) : null;
    }

    public List<String> getAlarms() {
        return alarms;
    }

    public void setAlarms(List<String> alarms) {
        this.alarms = alarms != null ? new ArrayList<>(alarms) : new ArrayList<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TrendConfig that))
            return false;
        return Objects.equals(name, that.name) && Objects.equals(metric, that.metric);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, metric);
    }

    @Override
    public String toString() {
        return "TrendConfig{" +
                "name='" + name + '\'' +
                ", metric='" + metric + '\'' +
                ", histograms=" + histograms +
                ", alarms=" + alarms +
                '}';
    }
}
