package com.mealshift.orderservice.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Pushes committed engine events to every open stream on the fan-out executor.
 * Events from rolled-back transactions are never delivered.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventFanout {

    private final SubscriberRegistry subscriberRegistry;

    @Async("fanoutExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onEngineEvent(EngineEvent event) {
        try {
            int delivered = subscriberRegistry.broadcast(EventEnvelope.of(event));
            log.debug("Event fanned out: type={}, delivered={}", event.getType().getWireName(), delivered);
        } catch (RuntimeException e) {
            log.warn("Event fan-out failed: type={}", event.getType().getWireName(), e);
        }
    }
}
