package com.mealshift.orderservice.service;

import com.mealshift.common.contracts.AuditRecordContract;
import com.mealshift.common.exception.ResourceNotFoundException;
import com.mealshift.orderservice.audit.AuditSink;
import com.mealshift.orderservice.dto.NoShowNotice;
import com.mealshift.orderservice.dto.OrderResponse;
import com.mealshift.orderservice.event.EventPublisher;
import com.mealshift.orderservice.event.EventType;
import com.mealshift.orderservice.exception.OrderAlreadyFinalizedException;
import com.mealshift.orderservice.mapper.OrderMapper;
import com.mealshift.orderservice.model.Order;
import com.mealshift.orderservice.model.OrderStatus;
import com.mealshift.orderservice.repository.OrderRepository;
import com.mealshift.orderservice.time.ClockSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * The only place where an order's status is written.
 *
 * <p>Every transition out of PLACED is a conditional update on (id, PLACED), so when a
 * request and the sweep (or two requests) race, exactly one of them wins. Each applied
 * transition is audited and published; a missed collection also accrues a strike.
 * All methods expect to join a transaction started by the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderStateMachine {

    private final OrderRepository orderRepository;
    private final StrikeLedger strikeLedger;
    private final EventPublisher eventPublisher;
    private final AuditSink auditSink;
    private final OrderMapper orderMapper;
    private final ClockSource clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public Order place(Order order) {
        Instant now = clock.now();
        order.setStatus(OrderStatus.PLACED);
        order.setLiveDate(order.getOrderDate());
        order.setCreatedAt(now);
        Order saved = orderRepository.saveAndFlush(order);

        log.info("Order placed: orderId={}, personId={}, shiftId={}, date={}",
                saved.getId(), saved.getPersonId(), saved.getShiftId(), saved.getOrderDate());
        audit(saved, null, OrderStatus.PLACED, "order.created", saved.getPersonId(), "Order placed", Map.of());
        eventPublisher.publish(EventType.ORDER_CREATED, orderMapper.toOrderResponse(saved));
        return saved;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Order collect(Order order, UUID collectedBy, String collectionPoint) {
        requireTransition(order, OrderStatus.COLLECTED, "collect");
        Instant now = clock.now();
        int updated = orderRepository.markCollected(order.getId(), OrderStatus.PLACED, OrderStatus.COLLECTED,
                now, collectedBy, collectionPoint);
        Order collected = reloadAfter(updated, order, "collect");

        log.info("Order status updated: orderId={}, from={}, to={}", order.getId(), OrderStatus.PLACED,
                OrderStatus.COLLECTED);
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("collectionPoint", collectionPoint);
        audit(collected, OrderStatus.PLACED, OrderStatus.COLLECTED, "order.checkin", collectedBy,
                "Meal collected", metadata);
        eventPublisher.publish(EventType.ORDER_CHECKIN, orderMapper.toOrderResponse(collected));
        return collected;
    }

    /**
     * @param cancelledBy null when the engine itself cancels (restriction, horizon change)
     * @param late        cancellation after the cutoff; recorded for audit, never a strike
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Order cancel(Order order, UUID cancelledBy, String reason, boolean late) {
        requireTransition(order, OrderStatus.CANCELLED, "cancel");
        Instant now = clock.now();
        int updated = orderRepository.markCancelled(order.getId(), OrderStatus.PLACED, OrderStatus.CANCELLED,
                now, cancelledBy, reason, late);
        Order cancelled = reloadAfter(updated, order, "cancel");

        if (late) {
            log.warn("Late cancellation: orderId={}, personId={}, by={}", order.getId(), order.getPersonId(),
                    cancelledBy);
        }
        log.info("Order status updated: orderId={}, from={}, to={}", order.getId(), OrderStatus.PLACED,
                OrderStatus.CANCELLED);
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("reason", reason);
        metadata.put("lateCancellation", late);
        metadata.put("system", cancelledBy == null);
        audit(cancelled, OrderStatus.PLACED, OrderStatus.CANCELLED,
                late ? "order.cancelled.late" : "order.cancelled", cancelledBy,
                late ? "Order cancelled after cutoff" : "Order cancelled", metadata);
        eventPublisher.publish(EventType.ORDER_CANCELLED, orderMapper.toOrderResponse(cancelled));
        return cancelled;
    }

    /**
     * Marks a missed collection and accrues the strike. Returns empty, without side effects,
     * when the order is no longer PLACED.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<StrikeAccrual> markNotCollected(Order order) {
        Instant now = clock.now();
        int updated = orderRepository.markNotCollected(order.getId(), OrderStatus.PLACED,
                OrderStatus.NOT_COLLECTED, now);
        if (updated == 0) {
            log.debug("Order already left PLACED, not marking as missed: orderId={}", order.getId());
            return Optional.empty();
        }
        Order missed = orderRepository.findById(order.getId())
                .orElseThrow(() -> new ResourceNotFoundException("Order not found with id: " + order.getId()));

        log.info("Order status updated: orderId={}, from={}, to={}", order.getId(), OrderStatus.PLACED,
                OrderStatus.NOT_COLLECTED);
        audit(missed, OrderStatus.PLACED, OrderStatus.NOT_COLLECTED, "order.noshow", null,
                "Collection window closed without pickup", Map.of());

        StrikeAccrual accrual = strikeLedger.accrueFailure(missed.getPersonId(), missed.getId());
        OrderResponse response = orderMapper.toOrderResponse(missed);
        eventPublisher.publish(EventType.ORDER_NOSHOW, NoShowNotice.builder()
                .order(response)
                .strikeCount(accrual.getStrikeCount())
                .restrictionOpened(accrual.restrictionOpened())
                .build());
        return Optional.of(accrual);
    }

    private void requireTransition(Order order, OrderStatus target, String action) {
        if (!order.getStatus().canTransitionTo(target)) {
            log.warn("Invalid state transition: orderId={}, currentStatus={}, attemptedAction={}",
                    order.getId(), order.getStatus(), action);
            throw new OrderAlreadyFinalizedException(order.getId(), order.getStatus());
        }
    }

    // 0 rows means a concurrent writer moved the order first
    private Order reloadAfter(int updated, Order order, String action) {
        Order current = orderRepository.findById(order.getId())
                .orElseThrow(() -> new ResourceNotFoundException("Order not found with id: " + order.getId()));
        if (updated == 0) {
            log.warn("Lost transition race: orderId={}, currentStatus={}, attemptedAction={}",
                    order.getId(), current.getStatus(), action);
            throw new OrderAlreadyFinalizedException(order.getId(), current.getStatus());
        }
        return current;
    }

    private void audit(Order order, OrderStatus from, OrderStatus to, String action, UUID actorId,
                       String description, Map<String, Object> metadata) {
        Map<String, Object> details = new HashMap<>(metadata);
        details.put("shiftId", order.getShiftId().toString());
        details.put("orderDate", order.getOrderDate().toString());
        auditSink.record(AuditRecordContract.builder()
                .action(action)
                .entityType("ORDER")
                .entityId(order.getId().toString())
                .actorId(actorId)
                .personId(order.getPersonId())
                .fromStatus(from == null ? null : from.name())
                .toStatus(to.name())
                .description(description)
                .metadata(details)
                .occurredAt(clock.now())
                .build());
    }
}
