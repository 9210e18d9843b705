package com.trendwatch.core.metric;

import com.trendwatch.core.model.BinnedHistogram;
import com.trendwatch.core.model.Sample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for the built-in {@link MetricExtractor} variants and their
 * lookup.
 */
class MetricExtractorsTest {

    private static final BinnedHistogram PEAKED = BinnedHistogram.of("peaked", 0, 10, 0, 0, 8, 0, 0);
    private static final BinnedHistogram FLAT = BinnedHistogram.of("flat", 0, 4, 1, 1, 1, 1);
    private static final BinnedHistogram EMPTY = BinnedHistogram.of("empty", 0, 4, 0, 0, 0, 0);

    @Test
    @DisplayName("Should resolve every supported tag")
    void shouldResolveSupportedTags() {
        for (String tag : MetricExtractors.SUPPORTED) {
            assertThat(MetricExtractors.forName(tag))
                    .as("tag %s", tag)
                    .hasValueSatisfying(e -> assertThat(e.getName()).isEqualTo(tag));
        }
    }

    @Test
    @DisplayName("Should resolve tags case-insensitively")
    void shouldResolveCaseInsensitive() {
        assertThat(MetricExtractors.forName("MEAN")).containsInstanceOf(MeanExtractor.class);
        assertThat(MetricExtractors.forName("stddev")).containsInstanceOf(StdDevExtractor.class);
        assertThat(MetricExtractors.forName("max")).containsInstanceOf(MaximumExtractor.class);
    }

    @Test
    @DisplayName("Should return empty for unknown or null tags")
    void shouldReturnEmptyForUnknown() {
        assertThat(MetricExtractors.forName("median")).isEmpty();
        assertThat(MetricExtractors.forName(null)).isEmpty();
    }

    @Test
    @DisplayName("Mean extractor should return mean and its error")
    void meanShouldReturnMeanAndError() throws ExtractionException {
        Sample sample = new MeanExtractor().extract(FLAT);

        assertThat(sample.getValue()).isCloseTo(2.0, within(1e-12));
        assertThat(sample.getError()).isCloseTo(FLAT.getMeanError(), within(1e-12));
    }

    @Test
    @DisplayName("StdDev extractor should return zero spread for a single populated bin")
    void stdDevShouldBeZeroForSingleBin() throws ExtractionException {
        Sample sample = new StdDevExtractor().extract(PEAKED);

        assertThat(sample.getValue()).isZero();
        assertThat(sample.getError()).isZero();
    }

    @Test
    @DisplayName("Maximum extractor should return highest bin with zero error")
    void maximumShouldReturnHighestBin() throws ExtractionException {
        Sample sample = new MaximumExtractor().extract(PEAKED);

        assertThat(sample).isEqualTo(Sample.of(8, 0));
    }

    @Test
    @DisplayName("Maximum extractor should accept an all-zero histogram")
    void maximumShouldAcceptEmptyContents() throws ExtractionException {
        assertThat(new MaximumExtractor().extract(EMPTY)).isEqualTo(Sample.of(0, 0));
    }

    @Test
    @DisplayName("Maximum extractor should fail on a histogram without bins")
    void maximumShouldFailWithoutBins() {
        BinnedHistogram noBins = BinnedHistogram.of("nobins", 0, 1);

        assertThatThrownBy(() -> new MaximumExtractor().extract(noBins))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("without bins");
    }

    @Test
    @DisplayName("Mean and stdDev extractors should fail on an empty histogram")
    void momentsShouldFailOnEmptyHistogram() {
        assertThatThrownBy(() -> new MeanExtractor().extract(EMPTY))
                .isInstanceOfSatisfying(ExtractionException.class,
                        e -> assertThat(e.getHistogramName()).isEqualTo("empty"));
        assertThatThrownBy(() -> new StdDevExtractor().extract(EMPTY))
                .isInstanceOf(ExtractionException.class);
    }
}
