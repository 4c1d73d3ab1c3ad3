package com.mealshift.orderservice.time;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * The single source of "now" for every cutoff, horizon and window decision.
 */
public interface ClockSource {

    Instant now();

    /**
     * Business time zone in which order dates and shift times are interpreted.
     */
    ZoneId zone();

    default LocalDate today() {
        return LocalDate.ofInstant(now(), zone());
    }
}
