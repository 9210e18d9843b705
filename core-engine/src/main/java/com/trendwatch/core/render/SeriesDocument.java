package com.trendwatch.core.render;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trendwatch.core.model.SeriesPoint;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * JSON description of a rendered trend, written next to its image.
 *
 * <pre>
 * {
 *   "name": "EMCTRQA_ampMean",
 *   "title": "Mean amplitude",
 *   "subsystem": "EMC",
 *   "points": [{"x": 0, "y": 1.0, "yError": 0.0}, ...]
 * }
 * </pre>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SeriesDocument {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private String name;
    private String title;
    private String subsystem;
    private List<SeriesPoint> points = new ArrayList<>();

    /** No-arg constructor required by Jackson. */
    public SeriesDocument() {
    }

    public SeriesDocument(String name, String title, String subsystem, List<SeriesPoint> points) {
        this.name = name;
        this.title = title;
        this.subsystem = subsystem;
        setPoints(points);
    }

    /**
     * @param request the render request to describe
     * @return a document holding the request's series
     */
    public static SeriesDocument from(RenderRequest request) {
        Objects.requireNonNull(request, "RenderRequest must not be null");
        return new SeriesDocument(request.getTrendName(), request.getTitle(),
                request.getSubsystemName(), request.getSeries());
    }

    /**
     * @return UTF-8 encoded JSON
     * @throws JsonProcessingException if serialization fails
     */
    public byte[] toJson() throws JsonProcessingException {
        return MAPPER.writeValueAsBytes(this);
    }

    /**
     * @param json UTF-8 encoded JSON, as produced by {@link #toJson()}
     * @return the parsed document
     * @throws IOException if the bytes are not a valid document
     */
    public static SeriesDocument fromJson(byte[] json) throws IOException {
        Objects.requireNonNull(json, "JSON must not be null");
        return MAPPER.readValue(json, SeriesDocument.class);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getSubsystem() {
        return subsystem;
    }

    public void setSubsystem(String subsystem) {
        this.subsystem = subsystem;
    }

    /**
     * @return unmodifiable list of points in plotting order
     */
    public List<SeriesPoint> getPoints() {
        return Collections.unmodifiableList(points);
    }

    public void setPoints(List<SeriesPoint> points) {
        this.points = points != null ? new ArrayList<>(points) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "SeriesDocument{" +
                "name='" + name + '\'' +
                ", subsystem='" + subsystem + '\'' +
                ", points=" + points.size() +
                '}';
    }
}
