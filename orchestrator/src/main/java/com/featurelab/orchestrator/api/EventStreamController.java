package com.featurelab.orchestrator.api;

import com.featurelab.orchestrator.notify.SseNotificationEmitter;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * GET /events: the caller's live notification stream.
 *
 * Each event is named after its action tag and carries the notification
 * as JSON. Events for a user with no open stream are dropped.
 */
@RestController
public class EventStreamController {

    private final SseNotificationEmitter emitter;

    public EventStreamController(SseNotificationEmitter emitter) {
        this.emitter = emitter;
    }

    @GetMapping(path = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@RequestHeader(FeaturesetController.USER_HEADER) String username) {
        return emitter.subscribe(username);
    }
}
