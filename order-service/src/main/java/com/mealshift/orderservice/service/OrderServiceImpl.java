package com.mealshift.orderservice.service;

import com.mealshift.common.exception.AccessDeniedException;
import com.mealshift.common.exception.ResourceNotFoundException;
import com.mealshift.orderservice.dto.BulkOrderFailure;
import com.mealshift.orderservice.dto.BulkOrderRequest;
import com.mealshift.orderservice.dto.BulkOrderResponse;
import com.mealshift.orderservice.dto.CancelOrderRequest;
import com.mealshift.orderservice.dto.CollectByCodeRequest;
import com.mealshift.orderservice.dto.CollectOrderRequest;
import com.mealshift.orderservice.dto.OrderRequest;
import com.mealshift.orderservice.dto.OrderResponse;
import com.mealshift.orderservice.dto.OrderStatisticsResponse;
import com.mealshift.orderservice.exception.OrderAlreadyFinalizedException;
import com.mealshift.orderservice.exception.OrderRejectedException;
import com.mealshift.orderservice.exception.RejectionReason;
import com.mealshift.orderservice.mapper.OrderMapper;
import com.mealshift.orderservice.model.Order;
import com.mealshift.orderservice.model.OrderStatus;
import com.mealshift.orderservice.model.Person;
import com.mealshift.orderservice.model.Policy;
import com.mealshift.orderservice.model.Restriction;
import com.mealshift.orderservice.model.Shift;
import com.mealshift.orderservice.model.ShiftWindow;
import com.mealshift.orderservice.model.WeeklyCutoff;
import com.mealshift.orderservice.repository.OrderRepository;
import com.mealshift.orderservice.repository.PersonRepository;
import com.mealshift.orderservice.security.CallerIdentity;
import com.mealshift.orderservice.security.CallerIdentityResolver;
import com.mealshift.orderservice.time.ClockSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Booking rules around the order state machine.
 *
 * <p>Create/collect/cancel each run through {@link TransitionRetrier} in a fresh transaction,
 * so this class does not declare transactions on those methods itself.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderServiceImpl implements OrderService {

    private static final String PICKUP_CODE_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    private static final int PICKUP_CODE_LENGTH = 10;
    private static final int PICKUP_CODE_ATTEMPTS = 3;
    private static final DateTimeFormatter DISPLAY_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final OrderRepository orderRepository;
    private final PersonRepository personRepository;
    private final OrderStateMachine stateMachine;
    private final StrikeLedger strikeLedger;
    private final ShiftCalendarService shiftCalendar;
    private final PolicyStore policyStore;
    private final ClockSource clock;
    private final TransitionRetrier transitionRetrier;
    private final CallerIdentityResolver identityResolver;
    private final OrderMapper orderMapper;

    private final SecureRandom random = new SecureRandom();

    @Override
    public OrderResponse createOrder(OrderRequest orderRequest, Jwt jwt) {
        CallerIdentity caller = identityResolver.resolve(jwt);
        UUID personId = caller.getPersonId();
        LocalDate orderDate = orderRequest.getOrderDate();
        log.info("Order creation started: personId={}, shiftId={}, date={}", personId, orderRequest.getShiftId(),
                orderDate);

        // one snapshot for the whole evaluation
        Policy policy = policyStore.current();
        Instant now = clock.now();
        LocalDate today = LocalDate.ofInstant(now, clock.zone());

        Person person = personRepository.findById(personId)
                .orElseThrow(() -> {
                    log.warn("Order creation by unknown person: personId={}", personId);
                    return new ResourceNotFoundException("Person not found with id: " + personId);
                });
        if (!person.isActive()) {
            log.warn("Order creation by inactive person: personId={}", personId);
            throw new AccessDeniedException("Access Denied: account is inactive");
        }

        Optional<Restriction> restriction = strikeLedger.restrictionInEffect(personId, now);
        if (restriction.isPresent()) {
            Instant endsAt = restriction.get().getEndsAt();
            throw reject(personId, RejectionReason.RESTRICTED, endsAt == null
                    ? "You are restricted from ordering until further notice"
                    : "You are restricted from ordering until " + format(endsAt));
        }

        if (orderDate.isBefore(today)) {
            throw reject(personId, RejectionReason.HORIZON_EXCEEDED, "Cannot order for a past date: " + orderDate);
        }
        WeeklyCutoff weeklyCutoff = policy.isWeekly() ? policy.weeklyCutoff() : null;
        if (weeklyCutoff != null) {
            if (weeklyCutoff.isBeyondHorizon(orderDate, now, clock.zone())) {
                throw reject(personId, RejectionReason.HORIZON_EXCEEDED, "Orders can be placed at most "
                        + weeklyCutoff.getMaxWeeksAhead() + " week(s) ahead of the next open week");
            }
        } else {
            LocalDate lastBookable = today.plusDays(policy.getBookingHorizonDays());
            if (orderDate.isAfter(lastBookable)) {
                throw reject(personId, RejectionReason.HORIZON_EXCEEDED, "Orders can be placed at most "
                        + policy.getBookingHorizonDays() + " days in advance (latest date: " + lastBookable + ")");
            }
        }

        Shift shift;
        try {
            shift = shiftCalendar.requireBookableShift(orderRequest.getShiftId(), orderDate, personId);
        } catch (OrderRejectedException e) {
            throw reject(personId, e.getReason(), e.getMessage());
        }

        if (weeklyCutoff != null && !weeklyCutoff.isOrderableDay(orderDate)) {
            throw reject(personId, RejectionReason.SHIFT_UNAVAILABLE,
                    "Meals are not served on " + orderDate.getDayOfWeek() + "s");
        }

        Instant cutoffAt = ShiftWindow.of(shift, orderDate, clock.zone()).cutoffAt(policy);
        if (!now.isBefore(cutoffAt)) {
            throw reject(personId, RejectionReason.CUTOFF_PASSED, "Ordering for " + shift.getName() + " on "
                    + orderDate + " closed at " + format(cutoffAt));
        }

        if (orderRepository.existsByPersonIdAndOrderDateAndStatusNot(personId, orderDate, OrderStatus.CANCELLED)) {
            throw reject(personId, RejectionReason.DUPLICATE_FOR_DATE,
                    "You already have an order for " + orderDate);
        }

        Order saved = place(personId, shift, orderDate);
        return orderMapper.toOrderResponse(saved);
    }

    @Override
    public BulkOrderResponse bulkCreateOrders(BulkOrderRequest request, Jwt jwt) {
        List<OrderRequest> items = request.getOrders();
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("At least one order is required");
        }
        if (items.size() > BulkOrderRequest.MAX_ITEMS) {
            throw new IllegalArgumentException("At most " + BulkOrderRequest.MAX_ITEMS + " orders per request");
        }

        List<OrderResponse> created = new ArrayList<>();
        List<BulkOrderFailure> failed = new ArrayList<>();
        for (OrderRequest item : items) {
            try {
                created.add(createOrder(item, jwt));
            } catch (OrderRejectedException e) {
                failed.add(BulkOrderFailure.builder()
                        .orderDate(item.getOrderDate())
                        .shiftId(item.getShiftId())
                        .reason(e.getReason())
                        .message(e.getMessage())
                        .build());
            }
        }
        log.info("Bulk order finished: requested={}, created={}, failed={}", items.size(), created.size(),
                failed.size());
        return BulkOrderResponse.builder()
                .created(created)
                .failed(failed)
                .build();
    }

    @Override
    public OrderResponse collectOrder(UUID orderId, CollectOrderRequest request, Jwt jwt) {
        CallerIdentity caller = identityResolver.resolve(jwt);
        requireCollector(caller, orderId);
        String collectionPoint = request == null ? null : request.getCollectionPoint();

        return transitionRetrier.execute("collect", () -> {
            Order order = findOrder(orderId);
            return orderMapper.toOrderResponse(collect(order, caller, collectionPoint));
        });
    }

    @Override
    public OrderResponse collectByPickupCode(CollectByCodeRequest request, Jwt jwt) {
        CallerIdentity caller = identityResolver.resolve(jwt);
        String code = request.getPickupCode().trim().toUpperCase();
        requireCollector(caller, null);

        return transitionRetrier.execute("collect", () -> {
            Order order = orderRepository.findByPickupCode(code)
                    .orElseThrow(() -> {
                        log.warn("Unknown pickup code presented: by={}", caller.getPersonId());
                        return new ResourceNotFoundException("No order with this pickup code");
                    });
            return orderMapper.toOrderResponse(collect(order, caller, request.getCollectionPoint()));
        });
    }

    @Override
    public OrderResponse cancelOrder(UUID orderId, CancelOrderRequest request, Jwt jwt) {
        CallerIdentity caller = identityResolver.resolve(jwt);
        String reason = request == null ? null : request.getReason();

        return transitionRetrier.execute("cancel", () -> {
            Order order = findOrder(orderId);
            if (!order.getPersonId().equals(caller.getPersonId()) && !caller.isAdmin()) {
                log.warn("Access denied: person {} attempted to cancel order {} of person {}",
                        caller.getPersonId(), orderId, order.getPersonId());
                throw new AccessDeniedException("Access Denied: you can only cancel your own orders");
            }
            if (order.getStatus().isTerminal()) {
                log.warn("Invalid state transition: orderId={}, currentStatus={}, attemptedAction=cancel",
                        orderId, order.getStatus());
                throw new OrderAlreadyFinalizedException(orderId, order.getStatus());
            }

            Policy policy = policyStore.current();
            ShiftWindow window = ShiftWindow.of(order, clock.zone());
            Instant now = clock.now();
            // past collection the outcome belongs to the attendance sweep
            Instant closesAt = window.collectionClosesAt(policy.getCollectionGraceMinutes());
            if (now.isAfter(closesAt)) {
                throw reject(order.getPersonId(), RejectionReason.COLLECTION_WINDOW_CLOSED,
                        "Collection closed at " + format(closesAt) + "; the order can no longer be cancelled");
            }
            Instant cutoffAt = window.cutoffAt(policy);
            boolean late = !now.isBefore(cutoffAt);
            if (late && !policy.isLateCancellationAllowed()) {
                throw reject(order.getPersonId(), RejectionReason.CUTOFF_PASSED,
                        "Cancellation closed at " + format(cutoffAt) + "; the meal can no longer be released");
            }
            return orderMapper.toOrderResponse(stateMachine.cancel(order, caller.getPersonId(), reason, late));
        });
    }

    @Override
    @Transactional(readOnly = true)
    public OrderResponse getOrderById(UUID orderId, Jwt jwt) {
        CallerIdentity caller = identityResolver.resolve(jwt);
        Order order = findOrder(orderId);
        if (!order.getPersonId().equals(caller.getPersonId()) && !caller.isStaff()) {
            log.warn("Access denied: person {} attempted to read order {}", caller.getPersonId(), orderId);
            throw new AccessDeniedException("Access Denied: you can only view your own orders");
        }
        return orderMapper.toOrderResponse(order);
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderResponse> getOrders(LocalDate from, LocalDate to, UUID personId, Jwt jwt) {
        CallerIdentity caller = identityResolver.resolve(jwt);
        requireRange(from, to);

        UUID scope = personId;
        if (!caller.isStaff()) {
            if (personId != null && !personId.equals(caller.getPersonId())) {
                throw new AccessDeniedException("Access Denied: you can only list your own orders");
            }
            scope = caller.getPersonId();
        }

        List<Order> orders = scope == null
                ? orderRepository.findByOrderDateBetweenOrderByOrderDateAscCreatedAtAsc(from, to)
                : orderRepository.findByPersonIdAndOrderDateBetweenOrderByOrderDateAscCreatedAtAsc(scope, from, to);
        return orders.stream()
                .map(orderMapper::toOrderResponse)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public OrderStatisticsResponse getStatistics(LocalDate from, LocalDate to, Jwt jwt) {
        CallerIdentity caller = identityResolver.resolve(jwt);
        caller.requireAnyRole("order statistics", CallerIdentity.ROLE_ADMIN, CallerIdentity.ROLE_CANTEEN);
        requireRange(from, to);

        Map<OrderStatus, Long> counts = new EnumMap<>(OrderStatus.class);
        for (Object[] row : orderRepository.countByStatusBetween(from, to)) {
            counts.put((OrderStatus) row[0], ((Number) row[1]).longValue());
        }
        long collected = counts.getOrDefault(OrderStatus.COLLECTED, 0L);
        long notCollected = counts.getOrDefault(OrderStatus.NOT_COLLECTED, 0L);
        long finished = collected + notCollected;
        double pickupRate = finished == 0 ? 0.0 : Math.round(collected * 1000.0 / finished) / 10.0;

        return OrderStatisticsResponse.builder()
                .from(from)
                .to(to)
                .total(counts.values().stream().mapToLong(Long::longValue).sum())
                .placed(counts.getOrDefault(OrderStatus.PLACED, 0L))
                .collected(collected)
                .notCollected(notCollected)
                .cancelled(counts.getOrDefault(OrderStatus.CANCELLED, 0L))
                .pickupRate(pickupRate)
                .build();
    }

    @Override
    public int cancelUpcomingOrders(UUID personId, String reason) {
        List<Order> upcoming = orderRepository.findByPersonIdAndStatusAndOrderDateGreaterThanEqual(
                personId, OrderStatus.PLACED, clock.today());
        int cancelled = releaseAll(upcoming, reason);
        log.info("Released upcoming orders: personId={}, cancelled={}, candidates={}", personId, cancelled,
                upcoming.size());
        return cancelled;
    }

    @Override
    public int cancelOrdersAfter(LocalDate lastBookableDate, String reason) {
        List<Order> beyond = orderRepository.findByStatusAndOrderDateAfter(OrderStatus.PLACED, lastBookableDate);
        int cancelled = releaseAll(beyond, reason);
        log.info("Released orders beyond {}: cancelled={}, candidates={}", lastBookableDate, cancelled,
                beyond.size());
        return cancelled;
    }

    // System cancellations: each order in its own transaction, one failure does not stop the rest
    private int releaseAll(List<Order> orders, String reason) {
        int cancelled = 0;
        for (Order candidate : orders) {
            try {
                boolean applied = transitionRetrier.execute("release", () -> {
                    Order order = findOrder(candidate.getId());
                    if (order.getStatus().isTerminal()) {
                        return false;
                    }
                    stateMachine.cancel(order, null, reason, false);
                    return true;
                });
                if (applied) {
                    cancelled++;
                }
            } catch (OrderAlreadyFinalizedException e) {
                log.debug("Order finalized concurrently, not released: orderId={}", candidate.getId());
            } catch (RuntimeException e) {
                log.error("Failed to release order: orderId={}", candidate.getId(), e);
            }
        }
        return cancelled;
    }

    private Order collect(Order order, CallerIdentity caller, String collectionPoint) {
        if (order.getStatus().isTerminal()) {
            log.warn("Invalid state transition: orderId={}, currentStatus={}, attemptedAction=collect",
                    order.getId(), order.getStatus());
            throw new OrderAlreadyFinalizedException(order.getId(), order.getStatus());
        }
        Policy policy = policyStore.current();
        ShiftWindow window = ShiftWindow.of(order, clock.zone());
        Instant now = clock.now();
        if (!window.acceptsCollectionAt(now, policy.getEarlyCollectionMinutes(), policy.getCollectionGraceMinutes())) {
            throw reject(order.getPersonId(), RejectionReason.COLLECTION_WINDOW_CLOSED,
                    "Collection for this order is open from "
                            + format(window.collectionOpensAt(policy.getEarlyCollectionMinutes())) + " to "
                            + format(window.collectionClosesAt(policy.getCollectionGraceMinutes())));
        }
        return stateMachine.collect(order, caller.getPersonId(), collectionPoint);
    }

    private void requireCollector(CallerIdentity caller, UUID orderId) {
        if (!caller.hasAnyRole(CallerIdentity.ROLE_CANTEEN, CallerIdentity.ROLE_ADMIN)) {
            log.warn("Access denied: person {} attempted to collect order {} without CANTEEN role",
                    caller.getPersonId(), orderId);
            throw new AccessDeniedException("Access Denied: only canteen staff can confirm collection");
        }
    }

    private Order findOrder(UUID orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> {
                    log.warn("Order not found: orderId={}", orderId);
                    return new ResourceNotFoundException("Order not found with id: " + orderId);
                });
    }

    private OrderRejectedException reject(UUID personId, RejectionReason reason, String message) {
        log.info("Order request rejected: personId={}, reason={}, detail={}", personId, reason, message);
        return new OrderRejectedException(reason, message);
    }

    private void requireRange(LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Both 'from' and 'to' dates are required");
        }
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("'to' must not be before 'from'");
        }
    }

    private String format(Instant instant) {
        ZoneId zone = clock.zone();
        return DISPLAY_TIME.format(instant.atZone(zone));
    }

    // Pickup codes are random; a clash with an existing code gets a fresh one
    private Order place(UUID personId, Shift shift, LocalDate orderDate) {
        for (int attempt = 1; ; attempt++) {
            String pickupCode = newPickupCode();
            try {
                return transitionRetrier.execute("create", () -> {
                    Order order = new Order();
                    order.setPersonId(personId);
                    order.bookShift(shift);
                    order.setOrderDate(orderDate);
                    order.setPickupCode(pickupCode);
                    return stateMachine.place(order);
                });
            } catch (DataIntegrityViolationException e) {
                if (!violates(e, Order.PICKUP_CODE_CONSTRAINT)) {
                    // a concurrent request took the (person, date) slot between the check and the insert
                    throw reject(personId, RejectionReason.DUPLICATE_FOR_DATE,
                            "You already have an order for " + orderDate);
                }
                if (attempt >= PICKUP_CODE_ATTEMPTS) {
                    log.error("Pickup code collided {} times: personId={}, date={}", attempt, personId, orderDate);
                    throw e;
                }
                log.warn("Pickup code collision, generating a new one: personId={}, attempt={}", personId, attempt);
            }
        }
    }

    static boolean violates(DataIntegrityViolationException e, String constraint) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException) {
                String name = ((ConstraintViolationException) cause).getConstraintName();
                if (name != null) {
                    return constraint.equalsIgnoreCase(name);
                }
            }
        }
        String message = e.getMostSpecificCause().getMessage();
        return message != null && message.toLowerCase().contains(constraint);
    }

    private String newPickupCode() {
        StringBuilder code = new StringBuilder(PICKUP_CODE_LENGTH);
        for (int i = 0; i < PICKUP_CODE_LENGTH; i++) {
            code.append(PICKUP_CODE_ALPHABET.charAt(random.nextInt(PICKUP_CODE_ALPHABET.length())));
        }
        return code.toString();
    }
}
