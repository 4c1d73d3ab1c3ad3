package com.mealshift.orderservice.event;

import com.mealshift.orderservice.config.MealshiftProperties;
import com.mealshift.orderservice.dto.FanoutStatusResponse;
import com.mealshift.orderservice.support.MutableClockSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class SubscriberRegistryTest {

    private SubscriberRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SubscriberRegistry(new MealshiftProperties(),
                new MutableClockSource(Instant.parse("2026-03-10T05:00:00Z")));
    }

    @Test
    void broadcast_ReachesEveryOpenStream() {
        registry.register("tab-1", UUID.randomUUID(), "USER");
        registry.register("tab-2", UUID.randomUUID(), "CANTEEN");

        int delivered = registry.broadcast(envelope());

        assertThat(delivered).isEqualTo(2);
    }

    @Test
    void broadcast_DropsStreamThatCannotBeWritten() {
        SseEmitter dead = registry.register("tab-1", UUID.randomUUID(), "USER");
        registry.register("tab-2", UUID.randomUUID(), "USER");
        dead.complete();

        int delivered = registry.broadcast(envelope());

        assertThat(delivered).isEqualTo(1);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void status_GroupsConnectionsByRole() {
        UUID personId = UUID.randomUUID();
        registry.register("tab-1", personId, "USER");
        registry.register("tab-1", personId, "USER");
        registry.register("kiosk", UUID.randomUUID(), "CANTEEN");

        FanoutStatusResponse status = registry.status();

        assertThat(status.getOpenConnections()).isEqualTo(3);
        assertThat(status.getDistinctClients()).isEqualTo(2);
        assertThat(status.getConnectionsByRole()).containsEntry("USER", 2L).containsEntry("CANTEEN", 1L);
    }

    @Test
    void closeAll_EmptiesRegistry() {
        registry.register("tab-1", UUID.randomUUID(), "ADMIN");

        registry.closeAll();

        assertThat(registry.size()).isZero();
        assertThat(registry.broadcast(envelope())).isZero();
    }

    private EventEnvelope envelope() {
        return EventEnvelope.of(new EngineEvent(EventType.ORDER_CREATED, Map.of("id", "x"),
                Instant.parse("2026-03-10T05:00:00Z")));
    }
}
