package com.mealshift.orderservice.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RestrictionTest {

    private static final Instant START = Instant.parse("2026-03-10T10:00:00Z");

    @Test
    void expiresWithoutAnyWriteOnceEndPasses() {
        Restriction restriction = restriction(START.plus(Duration.ofDays(7)));

        assertThat(restriction.isInEffectAt(START)).isTrue();
        assertThat(restriction.isInEffectAt(START.plus(Duration.ofDays(7)).minusMillis(1))).isTrue();
        assertThat(restriction.isInEffectAt(START.plus(Duration.ofDays(7)))).isFalse();
        assertThat(restriction.isActive()).isTrue();
    }

    @Test
    void notInEffectBeforeStart() {
        assertThat(restriction(null).isInEffectAt(START.minusSeconds(1))).isFalse();
    }

    @Test
    void indefiniteRestrictionLastsUntilLifted() {
        Restriction restriction = restriction(null);
        assertThat(restriction.isInEffectAt(START.plus(Duration.ofDays(3650)))).isTrue();

        restriction.setActive(false);
        assertThat(restriction.isInEffectAt(START.plusSeconds(1))).isFalse();
    }

    private static Restriction restriction(Instant endsAt) {
        Restriction restriction = new Restriction();
        restriction.setStartsAt(START);
        restriction.setEndsAt(endsAt);
        return restriction;
    }
}
