package com.mealshift.orderservice.service;

import com.mealshift.orderservice.event.BookingHorizonReducedEvent;
import com.mealshift.orderservice.event.RestrictionOpenedEvent;
import com.mealshift.orderservice.time.ClockSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Releases PLACED orders that are no longer allowed once a restriction or a shorter booking
 * horizon has been committed. Each release runs in its own transaction.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderReleaseListener {

    private static final DateTimeFormatter DISPLAY_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    private final OrderService orderService;
    private final ClockSource clock;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onRestrictionOpened(RestrictionOpenedEvent event) {
        String reason = event.getEndsAt() == null
                ? "Restricted until further notice"
                : "Restricted until " + DISPLAY_DATE.format(LocalDate.ofInstant(event.getEndsAt(), clock.zone()));
        try {
            int cancelled = orderService.cancelUpcomingOrders(event.getPersonId(), reason);
            log.info("Orders released after restriction: personId={}, restrictionId={}, cancelled={}",
                    event.getPersonId(), event.getRestrictionId(), cancelled);
        } catch (RuntimeException e) {
            log.error("Failed to release orders after restriction: personId={}", event.getPersonId(), e);
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onBookingHorizonReduced(BookingHorizonReducedEvent event) {
        try {
            int cancelled = orderService.cancelOrdersAfter(event.getLastBookableDate(),
                    "Booking horizon reduced to " + event.getCurrentHorizonDays() + " days");
            log.info("Orders released after horizon change: {} -> {} days, cancelled={}",
                    event.getPreviousHorizonDays(), event.getCurrentHorizonDays(), cancelled);
        } catch (RuntimeException e) {
            log.error("Failed to release orders beyond {}", event.getLastBookableDate(), e);
        }
    }
}
