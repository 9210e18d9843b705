package com.trendwatch.core.render;

import com.trendwatch.core.model.SeriesPoint;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.XYPlot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ChartArtifactRenderer}.
 */
class ChartArtifactRendererTest {

    private static final List<SeriesPoint> SERIES = List.of(SeriesPoint.of(0, 1, 0), SeriesPoint.of(1, 2, 0));

    private final ChartArtifactRenderer renderer = new ChartArtifactRenderer(200, 120);

    @Test
    @DisplayName("Should write the series as a JSON document")
    void shouldWriteJsonDocument() throws Exception {
        RenderedArtifacts artifacts = renderer.render(request("png"));

        SeriesDocument doc = SeriesDocument.fromJson(artifacts.getJson());
        assertThat(doc.getName()).isEqualTo("hits/mean");
        assertThat(doc.getTitle()).isEqualTo("Mean hits");
        assertThat(doc.getSubsystem()).isEqualTo("tracker");
        assertThat(doc.getPoints()).containsExactlyElementsOf(SERIES);
        assertThat(new String(artifacts.getJson(), StandardCharsets.UTF_8))
                .contains("\"yError\"");
    }

    @Test
    @DisplayName("Should encode a PNG image")
    void shouldEncodePng() throws Exception {
        RenderedArtifacts artifacts = renderer.render(request("png"));

        assertThat(artifacts.getImage()).startsWith((byte) 0x89, (byte) 'P', (byte) 'N', (byte) 'G');
        assertThat(artifacts.getImagePath()).isEqualTo(Path.of("out/tracker/img/hits_mean.png"));
    }

    @Test
    @DisplayName("Should encode a JPEG image")
    void shouldEncodeJpeg() throws Exception {
        RenderedArtifacts artifacts = renderer.render(request("jpg"));

        assertThat(artifacts.getImage()).startsWith((byte) 0xFF, (byte) 0xD8);
    }

    @Test
    @DisplayName("Should reject an unsupported image format")
    void shouldRejectUnsupportedFormat() {
        assertThatThrownBy(() -> renderer.render(request("gif")))
                .isInstanceOf(RenderException.class)
                .hasMessageContaining("gif");
    }

    @Test
    @DisplayName("Chart should plot one point per sample")
    void chartShouldPlotEverySample() {
        JFreeChart chart = ChartArtifactRenderer.createChart(request("png"));

        XYPlot plot = chart.getXYPlot();
        assertThat(plot.getDataset().getItemCount(0)).isEqualTo(2);
        assertThat(plot.getDataset().getYValue(0, 1)).isEqualTo(2.0);
        assertThat(chart.getTitle().getText()).isEqualTo("Mean hits");
    }

    private static RenderRequest request(String extension) {
        return new RenderRequest("hits/mean", "Mean hits", "tracker", SERIES, extension,
                ArtifactPaths.imagePath("out", "tracker", "hits/mean", extension),
                ArtifactPaths.jsonPath("out", "tracker", "hits/mean"));
    }
}
