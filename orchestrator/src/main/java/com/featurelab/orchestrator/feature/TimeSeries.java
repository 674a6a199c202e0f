package com.featurelab.orchestrator.feature;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One loaded time series: sample times, measurements and optional errors.
 *
 * Stored on disk as JSON:
 * <pre>
 *   {"name": "star_01", "label": "Mira", "time": [...], "measurement": [...], "error": [...]}
 * </pre>
 * {@code label} and {@code error} are optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TimeSeries(
        String   name,
        String   label,
        @JsonProperty("time")        double[] times,
        @JsonProperty("measurement") double[] measurements,
        @JsonProperty("error")       double[] errors) {

    public TimeSeries {
        if (times == null || measurements == null) {
            throw new IllegalArgumentException("Time series '" + name + "' needs both time and measurement arrays");
        }
        if (times.length != measurements.length) {
            throw new IllegalArgumentException("Time series '" + name + "' has " + times.length
                    + " sample times but " + measurements.length + " measurements");
        }
        if (errors != null && errors.length != measurements.length) {
            throw new IllegalArgumentException("Time series '" + name + "' has " + errors.length
                    + " errors for " + measurements.length + " measurements");
        }
    }

    public int size() {
        return measurements.length;
    }

    /** Copy with a different name; used when the file carries none. */
    public TimeSeries withName(String newName) {
        return new TimeSeries(newName, label, times, measurements, errors);
    }
}
