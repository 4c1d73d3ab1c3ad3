package com.mealshift.orderservice.time;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Local clock corrected by an offset learned from an external time reference.
 * With the reference disabled the offset is ignored and the local clock is returned as is.
 */
@Slf4j
public class ReferenceClockSource implements ClockSource {

    private final Clock localClock;
    private final ZoneId zone;
    private final boolean referenceEnabled;
    private final AtomicLong offsetMillis = new AtomicLong();
    private volatile Instant lastSyncAt;

    public ReferenceClockSource(Clock localClock, ZoneId zone, boolean referenceEnabled) {
        this.localClock = localClock;
        this.zone = zone;
        this.referenceEnabled = referenceEnabled;
    }

    @Override
    public Instant now() {
        Instant local = localClock.instant();
        return referenceEnabled ? local.plusMillis(offsetMillis.get()) : local;
    }

    @Override
    public ZoneId zone() {
        return zone;
    }

    public Instant localNow() {
        return localClock.instant();
    }

    public void applyOffset(long millis) {
        long previous = offsetMillis.getAndSet(millis);
        lastSyncAt = localClock.instant();
        if (Math.abs(previous - millis) > 1000) {
            log.info("Time reference offset changed: previousMs={}, currentMs={}", previous, millis);
        }
    }

    public long offsetMillis() {
        return offsetMillis.get();
    }

    public boolean isReferenceEnabled() {
        return referenceEnabled;
    }

    public Instant lastSyncAt() {
        return lastSyncAt;
    }
}
