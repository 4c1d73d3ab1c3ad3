package com.mealshift.orderservice.event;

import lombok.Value;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.UUID;

/**
 * One open event stream. Several connections may share a client token (e.g. browser tabs).
 */
@Value
public class EventSubscriber {
    String connectionId;
    String clientToken;
    UUID personId;
    String role;
    Instant connectedAt;
    SseEmitter emitter;
}
