package com.mealshift.orderservice.model;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.EnumSet;
import java.util.Set;

/**
 * Weekly ordering cycle. Weeks start on Monday; orders for a week close at a fixed
 * weekday and time in the week before it.
 */
public final class WeeklyCutoff {

    private final DayOfWeek cutoffDay;
    private final LocalTime cutoffTime;
    private final Set<DayOfWeek> orderableDays;
    private final int maxWeeksAhead;

    public WeeklyCutoff(DayOfWeek cutoffDay, LocalTime cutoffTime, Set<DayOfWeek> orderableDays, int maxWeeksAhead) {
        this.cutoffDay = cutoffDay;
        this.cutoffTime = cutoffTime;
        this.orderableDays = orderableDays.isEmpty()
                ? EnumSet.noneOf(DayOfWeek.class)
                : EnumSet.copyOf(orderableDays);
        this.maxWeeksAhead = maxWeeksAhead;
    }

    public static LocalDate weekStart(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    /**
     * Instant at which ordering, and cancelling without it counting as late, closes for the date.
     */
    public Instant cutoffFor(LocalDate orderDate, ZoneId zone) {
        LocalDate cutoffDate = weekStart(orderDate).minusWeeks(1).with(TemporalAdjusters.nextOrSame(cutoffDay));
        return cutoffDate.atTime(cutoffTime).atZone(zone).toInstant();
    }

    public boolean isOrderableDay(LocalDate date) {
        return orderableDays.contains(date.getDayOfWeek());
    }

    /**
     * True when the date lies more than {@code maxWeeksAhead} weeks past the nearest week still open.
     */
    public boolean isBeyondHorizon(LocalDate orderDate, Instant now, ZoneId zone) {
        LocalDate currentWeek = weekStart(LocalDate.ofInstant(now, zone));
        long weeksAhead = ChronoUnit.WEEKS.between(currentWeek, weekStart(orderDate));
        boolean nextWeekClosed = !now.isBefore(cutoffFor(currentWeek.plusWeeks(1), zone));
        long cyclesAhead = nextWeekClosed ? weeksAhead - 1 : weeksAhead;
        return cyclesAhead > maxWeeksAhead;
    }

    public int getMaxWeeksAhead() {
        return maxWeeksAhead;
    }
}
