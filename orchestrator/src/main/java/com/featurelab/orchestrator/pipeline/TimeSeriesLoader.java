package com.featurelab.orchestrator.pipeline;

import com.featurelab.orchestrator.feature.TimeSeries;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a time series from its storage location.
 *
 * Locations are plain filesystem paths or {@code file:} URIs. A series file
 * without a {@code name} is named after the file (minus its extension).
 */
@Component
public class TimeSeriesLoader {

    private final ObjectMapper json;

    public TimeSeriesLoader(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    /**
     * @throws PipelineException if the file is missing or not a valid series
     */
    public TimeSeries load(String location) {
        Path path = resolve(location);
        if (!Files.isRegularFile(path)) {
            throw new PipelineException("Time series file not found: " + location);
        }
        TimeSeries series;
        try {
            series = json.readValue(path.toFile(), TimeSeries.class);
        } catch (IOException e) {
            throw new PipelineException("Could not read time series " + location, e);
        }
        if (series == null) {
            throw new PipelineException("Empty time series file: " + location);
        }
        if (series.name() == null || series.name().isBlank()) {
            series = series.withName(baseName(path));
        }
        return series;
    }

    static Path resolve(String location) {
        if (location.startsWith("file:")) {
            return Path.of(URI.create(location));
        }
        return Path.of(location);
    }

    private static String baseName(Path path) {
        String file = path.getFileName().toString();
        int dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(0, dot) : file;
    }
}
