package com.featurelab.orchestrator.notify;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An out-of-band event pushed to a client's live connection.
 *
 * @param action  tag the client dispatches on
 * @param payload action-specific data; null for bare actions such as a refresh
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Notification(String action, Map<String, Object> payload) {

    /** Client shows {@code payload.note} as a toast. */
    public static final String SHOW_NOTIFICATION = "app/SHOW_NOTIFICATION";

    /** Client re-fetches its featureset list. */
    public static final String FETCH_FEATURESETS = "featurelab/FETCH_FEATURESETS";

    public Notification {
        payload = payload == null ? null : Map.copyOf(payload);
    }

    public static Notification note(String message) {
        return new Notification(SHOW_NOTIFICATION, Map.of("note", message));
    }

    public static Notification error(String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("note", message);
        payload.put("type", "error");
        return new Notification(SHOW_NOTIFICATION, payload);
    }

    public static Notification fetchFeaturesets() {
        return new Notification(FETCH_FEATURESETS, null);
    }
}
