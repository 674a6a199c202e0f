package com.featurelab.orchestrator.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link NotificationEmitter} over Server-Sent Events.
 *
 * Each browser tab opens {@code GET /events} and gets its own SseEmitter;
 * a user may therefore hold several connections at once. Connections are
 * dropped from the registry when they complete, time out or fail to send.
 */
@Component
public class SseNotificationEmitter implements NotificationEmitter {

    private static final Logger log = LoggerFactory.getLogger(SseNotificationEmitter.class);

    private final Map<String, List<SseEmitter>> connections = new ConcurrentHashMap<>();
    private final long timeoutMs;

    public SseNotificationEmitter(@Value("${featurelab.events.timeout-ms:1800000}") long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    /** Open a new event stream for {@code username}. */
    public SseEmitter subscribe(String username) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        // Add inside the map operation so a concurrent remove cannot drop the list under us.
        connections.compute(username, (u, list) -> {
            List<SseEmitter> emitters = list == null ? new CopyOnWriteArrayList<>() : list;
            emitters.add(emitter);
            return emitters;
        });
        emitter.onCompletion(() -> remove(username, emitter));
        emitter.onTimeout(() -> {
            remove(username, emitter);
            emitter.complete();
        });
        emitter.onError(e -> remove(username, emitter));
        log.debug("User '{}' subscribed to events ({} open)", username, connectionCount(username));
        return emitter;
    }

    @Override
    public void push(String username, Notification notification) {
        List<SseEmitter> emitters = connections.get(username);
        if (emitters == null || emitters.isEmpty()) {
            log.debug("No live connection for '{}', dropping {}", username, notification.action());
            return;
        }
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event()
                        .name(notification.action())
                        .data(notification, MediaType.APPLICATION_JSON));
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping dead connection for '{}': {}", username, e.getMessage());
                remove(username, emitter);
            }
        }
    }

    public int connectionCount(String username) {
        List<SseEmitter> emitters = connections.get(username);
        return emitters == null ? 0 : emitters.size();
    }

    private void remove(String username, SseEmitter emitter) {
        connections.computeIfPresent(username, (u, list) -> {
            list.remove(emitter);
            return list.isEmpty() ? null : list;
        });
    }
}
