package com.trendwatch.core.render;

import com.trendwatch.core.model.SeriesPoint;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.axis.NumberAxis;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYErrorRenderer;
import org.jfree.chart.title.TextTitle;
import org.jfree.data.xy.YIntervalSeries;
import org.jfree.data.xy.YIntervalSeriesCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.awt.Font;
import java.awt.geom.Ellipse2D;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders a trend as a JFreeChart scatter plot with vertical error bars,
 * plus its {@link SeriesDocument}.
 *
 * <p>
 * The x axis is the position inside the trend's buffer; the chart title is
 * the trend description and the subtitle names subsystem and trend. PNG and
 * JPEG output are supported.
 * </p>
 *
 * @since 1.0.0
 */
public class ChartArtifactRenderer implements ArtifactRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(ChartArtifactRenderer.class);

    public static final int DEFAULT_WIDTH = 800;
    public static final int DEFAULT_HEIGHT = 500;

    private static final Color POINT_COLOR = new Color(0x1a, 0x56, 0xdb);
    private static final Color GRID_COLOR = new Color(200, 200, 200);
    private static final Font SUBTITLE_FONT = new Font("SansSerif", Font.ITALIC, 10);

    private final int width;
    private final int height;

    public ChartArtifactRenderer() {
        this(DEFAULT_WIDTH, DEFAULT_HEIGHT);
    }

    /**
     * @param width  image width in pixels; must be positive
     * @param height image height in pixels; must be positive
     */
    public ChartArtifactRenderer(int width, int height) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException(
                    "Image size must be positive, got: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
    }

    @Override
    public RenderedArtifacts render(RenderRequest request) throws RenderException {
        Objects.requireNonNull(request, "RenderRequest must not be null");
        try {
            byte[] json = SeriesDocument.from(request).toJson();
            byte[] image = encode(createChart(request), request.getImageExtension());
            LOG.trace("Rendered trend [{}] with {} point(s)", request.getTrendName(), request.getSeries().size());
            return new RenderedArtifacts(request.getTrendName(),
                    request.getImagePath(), image, request.getJsonPath(), json);
        } catch (IOException e) {
            throw new RenderException("Failed to render trend '" + request.getTrendName() + "'", e);
        }
    }

    private byte[] encode(JFreeChart chart, String extension) throws IOException, RenderException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        switch (extension.toLowerCase(Locale.ROOT)) {
            case "png" -> ChartUtils.writeChartAsPNG(out, chart, width, height);
            case "jpg", "jpeg" -> ChartUtils.writeChartAsJPEG(out, chart, width, height);
            default -> throw new RenderException("Unsupported image format: '" + extension + "'");
        }
        return out.toByteArray();
    }

    static JFreeChart createChart(RenderRequest request) {
        YIntervalSeries series = new YIntervalSeries(request.getTrendName());
        for (SeriesPoint point : request.getSeries()) {
            series.add(point.getX(), point.getY(),
                    point.getY() - point.getYError(), point.getY() + point.getYError());
        }
        YIntervalSeriesCollection dataset = new YIntervalSeriesCollection();
        dataset.addSeries(series);

        NumberAxis xAxis = new NumberAxis("Entry");
        xAxis.setStandardTickUnits(NumberAxis.createIntegerTickUnits());
        NumberAxis yAxis = new NumberAxis(request.getTrendName());
        yAxis.setAutoRangeIncludesZero(false);

        XYErrorRenderer renderer = new XYErrorRenderer();
        renderer.setDrawXError(false);
        renderer.setDrawYError(true);
        renderer.setDefaultLinesVisible(false);
        renderer.setSeriesShapesVisible(0, true);
        renderer.setSeriesShape(0, new Ellipse2D.Double(-3, -3, 6, 6));
        renderer.setSeriesPaint(0, POINT_COLOR);

        XYPlot plot = new XYPlot(dataset, xAxis, yAxis, renderer);
        plot.setBackgroundPaint(Color.WHITE);
        plot.setDomainGridlinePaint(GRID_COLOR);
        plot.setRangeGridlinePaint(GRID_COLOR);

        JFreeChart chart = new JFreeChart(request.getTitle(), JFreeChart.DEFAULT_TITLE_FONT, plot, false);
        TextTitle subtitle = new TextTitle(request.getSubsystemName() + " / " + request.getTrendName(),
                SUBTITLE_FONT);
        subtitle.setPaint(Color.DARK_GRAY);
        chart.addSubtitle(subtitle);
        chart.setBackgroundPaint(Color.WHITE);
        return chart;
    }
}
