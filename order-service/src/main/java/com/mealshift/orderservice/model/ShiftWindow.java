package com.mealshift.orderservice.model;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * A shift pinned to a calendar date in the business time zone.
 */
public final class ShiftWindow {

    private final LocalDate date;
    private final ZoneId zone;
    private final Instant start;
    private final Instant end;
    // null when the shift has no meal break
    private final Instant breakStart;
    private final Instant breakEnd;

    private ShiftWindow(LocalDate date, ZoneId zone, Instant start, Instant end, Instant breakStart,
                        Instant breakEnd) {
        this.date = date;
        this.zone = zone;
        this.start = start;
        this.end = end;
        this.breakStart = breakStart;
        this.breakEnd = breakEnd;
    }

    /**
     * Window of a shift as currently configured; used when booking.
     */
    public static ShiftWindow of(Shift shift, LocalDate date, ZoneId zone) {
        return of(date, zone, shift.getStartTime(), shift.getEndTime(), shift.getBreakStartTime(),
                shift.getBreakEndTime());
    }

    /**
     * Window of a placed order, from the shift times copied onto it at booking.
     */
    public static ShiftWindow of(Order order, ZoneId zone) {
        return of(order.getOrderDate(), zone, order.getShiftStartTime(), order.getShiftEndTime(),
                order.getBreakStartTime(), order.getBreakEndTime());
    }

    static ShiftWindow of(LocalDate date, ZoneId zone, LocalTime startTime, LocalTime endTime,
                          LocalTime breakStartTime, LocalTime breakEndTime) {
        Instant start = at(date, startTime, zone);
        LocalDate endDate = endTime.isAfter(startTime) ? date : date.plusDays(1);
        Instant end = at(endDate, endTime, zone);

        Instant breakStart = null;
        Instant breakEnd = null;
        if (breakStartTime != null && breakEndTime != null) {
            // a break earlier in the day than the shift start belongs to the next day
            LocalDate breakDate = breakStartTime.isBefore(startTime) ? date.plusDays(1) : date;
            breakStart = at(breakDate, breakStartTime, zone);
            LocalDate breakEndDate = breakEndTime.isAfter(breakStartTime) ? breakDate : breakDate.plusDays(1);
            breakEnd = at(breakEndDate, breakEndTime, zone);
        }
        return new ShiftWindow(date, zone, start, end, breakStart, breakEnd);
    }

    private static Instant at(LocalDate date, LocalTime time, ZoneId zone) {
        return date.atTime(time).atZone(zone).toInstant();
    }

    public Instant start() {
        return start;
    }

    public Instant end() {
        return end;
    }

    public boolean hasBreak() {
        return breakStart != null;
    }

    public boolean breakWithinShift() {
        return !hasBreak() || (!breakStart.isBefore(start) && !breakEnd.isAfter(end));
    }

    /**
     * Last instant (exclusive) at which the order may still be placed or cleanly cancelled.
     */
    public Instant cutoffAt(Policy policy) {
        if (policy.isWeekly()) {
            return policy.weeklyCutoff().cutoffFor(date, zone);
        }
        return start.minus(Duration.ofDays(policy.getCutoffDays()))
                .minus(Duration.ofHours(policy.getCutoffLeadHours()));
    }

    // The break replaces the "early minutes before start" rule when the shift has one
    public Instant collectionOpensAt(int earlyMinutes) {
        return hasBreak() ? breakStart : start.minus(Duration.ofMinutes(earlyMinutes));
    }

    public Instant collectionClosesAt(int graceMinutes) {
        return (hasBreak() ? breakEnd : end).plus(Duration.ofMinutes(graceMinutes));
    }

    public boolean acceptsCollectionAt(Instant at, int earlyMinutes, int graceMinutes) {
        return !at.isBefore(collectionOpensAt(earlyMinutes)) && !at.isAfter(collectionClosesAt(graceMinutes));
    }

    /**
     * Instant after which an uncollected order counts as missed: the shift end plus grace, and
     * never before collection has closed.
     */
    public Instant missedAfter(int graceMinutes) {
        Instant shiftOver = end.plus(Duration.ofMinutes(graceMinutes));
        Instant collectionOver = collectionClosesAt(graceMinutes);
        return shiftOver.isAfter(collectionOver) ? shiftOver : collectionOver;
    }
}
