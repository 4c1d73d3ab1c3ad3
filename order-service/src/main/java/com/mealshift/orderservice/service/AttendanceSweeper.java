package com.mealshift.orderservice.service;

import com.mealshift.orderservice.dto.SweepResult;
import com.mealshift.orderservice.model.Order;
import com.mealshift.orderservice.model.OrderStatus;
import com.mealshift.orderservice.model.Policy;
import com.mealshift.orderservice.model.ShiftWindow;
import com.mealshift.orderservice.repository.OrderRepository;
import com.mealshift.orderservice.time.ClockSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Moves PLACED orders whose collection window has closed to NOT_COLLECTED.
 *
 * <p>Each order is transitioned in its own transaction through the same conditional update
 * a collection uses, so a sweep racing a late pickup loses cleanly. Sweeps may overlap, in this
 * process or across instances; an order already moved by one is skipped by the other.
 * Windows come from the shift times stored on the order, so later shift edits do not move them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AttendanceSweeper {

    private final OrderRepository orderRepository;
    private final OrderStateMachine stateMachine;
    private final PolicyStore policyStore;
    private final ClockSource clock;
    private final TransitionRetrier transitionRetrier;

    public SweepResult sweep() {
        Instant now = clock.now();
        Policy policy = policyStore.current();
        LocalDate today = LocalDate.ofInstant(now, clock.zone());
        List<Order> candidates = orderRepository.findByStatusAndOrderDateLessThanEqual(OrderStatus.PLACED, today);
        if (candidates.isEmpty()) {
            log.debug("Attendance sweep: no open orders up to {}", today);
            return SweepResult.builder().ranAt(now).build();
        }

        int due = 0;
        int transitioned = 0;
        int skipped = 0;
        int failed = 0;
        int restrictionsOpened = 0;

        for (Order order : candidates) {
            Instant missedAfter = ShiftWindow.of(order, clock.zone())
                    .missedAfter(policy.getCollectionGraceMinutes());
            if (!missedAfter.isBefore(now)) {
                continue;
            }
            due++;
            try {
                Optional<StrikeAccrual> accrual = transitionRetrier.execute("noshow",
                        () -> stateMachine.markNotCollected(order));
                if (accrual.isEmpty()) {
                    skipped++;
                } else {
                    transitioned++;
                    if (accrual.get().restrictionOpened()) {
                        restrictionsOpened++;
                    }
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Failed to mark order as not collected: orderId={}", order.getId(), e);
            }
        }

        SweepResult result = SweepResult.builder()
                .ranAt(now)
                .due(due)
                .transitioned(transitioned)
                .skipped(skipped)
                .failed(failed)
                .restrictionsOpened(restrictionsOpened)
                .build();
        if (due > 0) {
            log.info("Attendance sweep finished: due={}, transitioned={}, skipped={}, failed={}, restrictionsOpened={}",
                    due, transitioned, skipped, failed, restrictionsOpened);
        }
        return result;
    }
}
