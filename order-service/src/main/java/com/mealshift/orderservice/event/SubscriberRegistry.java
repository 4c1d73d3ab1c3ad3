package com.mealshift.orderservice.event;

import com.mealshift.orderservice.config.MealshiftProperties;
import com.mealshift.orderservice.dto.FanoutStatusResponse;
import com.mealshift.orderservice.time.ClockSource;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory registry of open event streams on this instance. There is no backlog:
 * a subscriber that is not connected when an event is broadcast never sees it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SubscriberRegistry {

    private final Map<String, EventSubscriber> subscribers = new ConcurrentHashMap<>();
    private final MealshiftProperties properties;
    private final ClockSource clock;

    public SseEmitter register(String clientToken, UUID personId, String role) {
        String connectionId = UUID.randomUUID().toString();
        SseEmitter emitter = new SseEmitter(properties.getFanout().getEmitterTimeout().toMillis());
        EventSubscriber subscriber = new EventSubscriber(connectionId, clientToken, personId, role, clock.now(), emitter);

        emitter.onCompletion(() -> remove(connectionId, "completed"));
        emitter.onTimeout(() -> remove(connectionId, "timeout"));
        emitter.onError(e -> remove(connectionId, "error"));
        subscribers.put(connectionId, subscriber);

        log.info("Event stream opened: connectionId={}, clientToken={}, personId={}, role={}, open={}",
                connectionId, clientToken, personId, role, subscribers.size());

        send(subscriber, SseEmitter.event()
                .name("connected")
                .data(Map.of("connectionId", connectionId, "timestamp", clock.now().toString()),
                        MediaType.APPLICATION_JSON));
        return emitter;
    }

    /**
     * Sends to every open stream.
     *
     * @return number of streams the event was written to
     */
    public int broadcast(EventEnvelope envelope) {
        int delivered = 0;
        for (EventSubscriber subscriber : subscribers.values()) {
            SseEmitter.SseEventBuilder event = SseEmitter.event()
                    .name(envelope.getEvent())
                    .data(envelope, MediaType.APPLICATION_JSON);
            if (send(subscriber, event)) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Writes a comment line to each stream, which also flushes out dead connections.
     */
    public void heartbeat() {
        for (EventSubscriber subscriber : subscribers.values()) {
            send(subscriber, SseEmitter.event().comment("heartbeat"));
        }
    }

    public int size() {
        return subscribers.size();
    }

    public FanoutStatusResponse status() {
        List<EventSubscriber> open = subscribers.values().stream()
                .sorted(Comparator.comparing(EventSubscriber::getConnectedAt))
                .toList();
        return FanoutStatusResponse.builder()
                .openConnections(open.size())
                .distinctClients(open.stream().map(EventSubscriber::getClientToken).distinct().count())
                .connectionsByRole(open.stream()
                        .collect(Collectors.groupingBy(EventSubscriber::getRole, Collectors.counting())))
                .connections(open.stream()
                        .map(s -> FanoutStatusResponse.Connection.builder()
                                .connectionId(s.getConnectionId())
                                .clientToken(s.getClientToken())
                                .personId(s.getPersonId())
                                .role(s.getRole())
                                .connectedAt(s.getConnectedAt())
                                .build())
                        .toList())
                .build();
    }

    @PreDestroy
    public void closeAll() {
        subscribers.values().forEach(subscriber -> subscriber.getEmitter().complete());
        subscribers.clear();
    }

    private boolean send(EventSubscriber subscriber, SseEmitter.SseEventBuilder event) {
        try {
            subscriber.getEmitter().send(event);
            return true;
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping event stream after failed write: connectionId={}, reason={}",
                    subscriber.getConnectionId(), e.getMessage());
            remove(subscriber.getConnectionId(), "write failed");
            return false;
        }
    }

    private void remove(String connectionId, String cause) {
        if (subscribers.remove(connectionId) != null) {
            log.info("Event stream closed: connectionId={}, cause={}, open={}", connectionId, cause, subscribers.size());
        }
    }
}
