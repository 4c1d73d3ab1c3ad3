package com.mealshift.orderservice.event;

import com.mealshift.orderservice.time.ClockSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Entry point for engine events. Delivery happens after the surrounding transaction
 * commits (see {@link EventFanout}); a failure here never reaches the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;
    private final ClockSource clock;

    public void publish(EventType type, Object payload) {
        try {
            applicationEventPublisher.publishEvent(new EngineEvent(type, payload, clock.now()));
        } catch (RuntimeException e) {
            log.warn("Failed to publish event: type={}", type.getWireName(), e);
        }
    }
}
