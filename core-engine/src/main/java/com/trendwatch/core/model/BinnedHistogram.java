package com.trendwatch.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable fixed-width one-dimensional histogram.
 *
 * <p>
 * Arrives as JSON inside a {@link HistogramBatch}:
 * </p>
 *
 * <pre>
 * {"name": "EMCTRQA_histAmp", "lowEdge": 0.0, "highEdge": 10.0,
 *  "contents": [0, 4, 9, 3]}
 * </pre>
 *
 * <h3>Statistics</h3>
 * <p>
 * Bin contents are treated as unweighted counts located at the bin centre.
 * The statistics are computed once at construction:
 * </p>
 * <ul>
 * <li>mean = &Sigma;c&middot;x / &Sigma;c</li>
 * <li>stdDev = sqrt(&Sigma;c&middot;x&sup2; / &Sigma;c &minus; mean&sup2;)</li>
 * <li>meanError = stdDev / sqrt(N), stdDevError = stdDev / sqrt(2N), with
 * N = &Sigma;c</li>
 * </ul>
 * <p>
 * An empty histogram (N = 0) reports {@code NaN} for every moment; the
 * extractors turn that into an
 * {@link com.trendwatch.core.metric.ExtractionException}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class BinnedHistogram implements HistogramSnapshot, Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final double lowEdge;
    private final double highEdge;
    private final double[] contents;

    private final double entries;
    private final double mean;
    private final double stdDev;
    private final double maximum;

    /**
     * @param name     histogram name; must not be {@code null}
     * @param lowEdge  lower edge of the first bin
     * @param highEdge upper edge of the last bin; must be greater than
     *                 {@code lowEdge}
     * @param contents bin contents (copied); must not be {@code null} and must
     *                 not contain negative values
     * @throws IllegalArgumentException if the axis or the contents are invalid
     */
    @JsonCreator
    public BinnedHistogram(@JsonProperty("name") String name,
            @JsonProperty("lowEdge") double lowEdge,
            @JsonProperty("highEdge") double highEdge,
            @JsonProperty("contents") double[] contents) {
        this.name = Objects.requireNonNull(name, "Histogram name must not be null");
        Objects.requireNonNull(contents, "Bin contents must not be null for histogram '" + name + "'");
        if (!(highEdge > lowEdge)) {
            throw new IllegalArgumentException("Histogram '" + name
                    + "' requires highEdge > lowEdge, got: [" + lowEdge + ", " + highEdge + "]");
        }
        this.lowEdge = lowEdge;
        this.highEdge = highEdge;
        this.contents = contents.clone();

        double width = (highEdge - lowEdge) / Math.max(1, this.contents.length);
        double sumW = 0;
        double sumWX = 0;
        double sumWX2 = 0;
        double max = this.contents.length > 0 ? Double.NEGATIVE_INFINITY : Double.NaN;
        for (int i = 0; i < this.contents.length; i++) {
            double c = this.contents[i];
            if (c < 0 || Double.isNaN(c)) {
                throw new IllegalArgumentException("Histogram '" + name
                        + "' has an invalid content in bin " + i + ": " + c);
            }
            double x = lowEdge + (i + 0.5) * width;
            sumW += c;
            sumWX += c * x;
            sumWX2 += c * x * x;
            max = Math.max(max, c);
        }

        this.entries = sumW;
        this.maximum = max;
        if (sumW > 0) {
            this.mean = sumWX / sumW;
            this.stdDev = Math.sqrt(Math.max(0, sumWX2 / sumW - mean * mean));
        } else {
            this.mean = Double.NaN;
            this.stdDev = Double.NaN;
        }
    }

    /**
     * Convenience factory for a histogram over {@code [lowEdge, highEdge)}.
     *
     * @param name     histogram name
     * @param lowEdge  lower axis edge
     * @param highEdge upper axis edge
     * @param contents bin contents
     * @return a new histogram
     */
    public static BinnedHistogram of(String name, double lowEdge, double highEdge, double... contents) {
        return new BinnedHistogram(name, lowEdge, highEdge, contents);
    }

    @Override
    public String getName() {
        return name;
    }

    public double getLowEdge() {
        return lowEdge;
    }

    public double getHighEdge() {
        return highEdge;
    }

    /**
     * @return a copy of the bin contents
     */
    public double[] getContents() {
        return contents.clone();
    }

    @JsonIgnore
    @Override
    public double getEntries() {
        return entries;
    }

    @JsonIgnore
    @Override
    public int getBinCount() {
        return contents.length;
    }

    @JsonIgnore
    @Override
    public double getMean() {
        return mean;
    }

    @JsonIgnore
    @Override
    public double getMeanError() {
        return entries > 0 ? stdDev / Math.sqrt(entries) : Double.NaN;
    }

    @JsonIgnore
    @Override
    public double getStdDev() {
        return stdDev;
    }

    @JsonIgnore
    @Override
    public double getStdDevError() {
        return entries > 0 ? stdDev / Math.sqrt(2 * entries) : Double.NaN;
    }

    @JsonIgnore
    @Override
    public double getMaximum() {
        return maximum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BinnedHistogram that))
            return false;
        return Double.compare(lowEdge, that.lowEdge) == 0
                && Double.compare(highEdge, that.highEdge) == 0
                && name.equals(that.name)
                && Arrays.equals(contents, that.contents);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(name, lowEdge, highEdge) + Arrays.hashCode(contents);
    }

    @Override
    public String toString() {
        return "BinnedHistogram{" +
                "name='" + name + '\'' +
                ", bins=" + contents.length +
                ", range=[" + lowEdge + ", " + highEdge + ")" +
                ", entries=" + entries +
                '}';
    }
}
