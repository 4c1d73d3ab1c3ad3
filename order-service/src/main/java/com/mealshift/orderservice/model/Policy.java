package com.mealshift.orderservice.model;

import lombok.Builder;
import lombok.Value;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.Set;
import java.util.UUID;

/**
 * Immutable policy snapshot. One snapshot is read per evaluation and never
 * re-read halfway through.
 */
@Value
@Builder(toBuilder = true)
public class Policy {

    CutoffMode cutoffMode;
    int cutoffDays;
    int cutoffLeadHours;
    DayOfWeek weeklyCutoffDay;
    int weeklyCutoffHour;
    int weeklyCutoffMinute;
    Set<DayOfWeek> orderableDays;
    int maxWeeksAhead;
    int strikeThreshold;
    int restrictionDurationDays;
    int bookingHorizonDays;
    boolean lateCancellationAllowed;
    int earlyCollectionMinutes;
    int collectionGraceMinutes;
    Instant updatedAt;
    UUID updatedBy;

    public Duration restrictionDuration() {
        return Duration.ofDays(restrictionDurationDays);
    }

    public boolean isWeekly() {
        return cutoffMode == CutoffMode.WEEKLY;
    }

    public WeeklyCutoff weeklyCutoff() {
        return new WeeklyCutoff(weeklyCutoffDay, LocalTime.of(weeklyCutoffHour, weeklyCutoffMinute),
                orderableDays == null ? Set.of() : orderableDays, maxWeeksAhead);
    }
}
