package com.mealshift.orderservice.support;

import com.mealshift.orderservice.time.ClockSource;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Clock that only moves when a test moves it.
 */
public class MutableClockSource implements ClockSource {

    public static final ZoneId ZONE = ZoneId.of("Asia/Jakarta");

    private volatile Instant now;

    public MutableClockSource(Instant start) {
        this.now = start;
    }

    public static MutableClockSource at(LocalDate date, LocalTime time) {
        return new MutableClockSource(date.atTime(time).atZone(ZONE).toInstant());
    }

    @Override
    public Instant now() {
        return now;
    }

    @Override
    public ZoneId zone() {
        return ZONE;
    }

    public void set(Instant instant) {
        this.now = instant;
    }

    public void setLocal(LocalDate date, LocalTime time) {
        this.now = date.atTime(time).atZone(ZONE).toInstant();
    }

    public void advance(Duration duration) {
        this.now = now.plus(duration);
    }
}
