package com.mealshift.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

@Entity
@Table(name = "orders",
        uniqueConstraints = {
                // liveDate is null once cancelled, so only live orders compete for the slot
                @UniqueConstraint(name = Order.PERSON_LIVE_DATE_CONSTRAINT, columnNames = {"person_id", "live_date"}),
                @UniqueConstraint(name = Order.PICKUP_CODE_CONSTRAINT, columnNames = {"pickup_code"})
        },
        indexes = {
                @Index(name = "idx_orders_status_date", columnList = "status, order_date"),
                @Index(name = "idx_orders_person_date", columnList = "person_id, order_date")
        })
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Order {

    public static final String PERSON_LIVE_DATE_CONSTRAINT = "uk_orders_person_live_date";
    public static final String PICKUP_CODE_CONSTRAINT = "uk_orders_pickup_code";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    @Column(name = "person_id", nullable = false)
    @ToString.Include
    private UUID personId;

    @Column(name = "shift_id", nullable = false)
    private UUID shiftId;

    // The day the meal is for, not the day it was ordered
    @Column(name = "order_date", nullable = false)
    @ToString.Include
    private LocalDate orderDate;

    @Column(name = "live_date")
    private LocalDate liveDate;

    // Shift times as they were when the order was placed; later shift edits do not move the order
    @Column(name = "shift_start_time", nullable = false)
    private LocalTime shiftStartTime;

    @Column(name = "shift_end_time", nullable = false)
    private LocalTime shiftEndTime;

    @Column(name = "break_start_time")
    private LocalTime breakStartTime;

    @Column(name = "break_end_time")
    private LocalTime breakEndTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @ToString.Include
    private OrderStatus status;

    @Column(name = "pickup_code", nullable = false, length = 16)
    private String pickupCode;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "collected_at")
    private Instant collectedAt;

    @Column(name = "collected_by")
    private UUID collectedBy;

    @Column(name = "collection_point", length = 100)
    private String collectionPoint;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    // null when the engine cancelled the order itself
    @Column(name = "cancelled_by")
    private UUID cancelledBy;

    @Column(name = "cancel_reason", length = 500)
    private String cancelReason;

    @Column(name = "late_cancellation", nullable = false)
    private boolean lateCancellation;

    @Column(name = "not_collected_at")
    private Instant notCollectedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public void bookShift(Shift shift) {
        this.shiftId = shift.getId();
        this.shiftStartTime = shift.getStartTime();
        this.shiftEndTime = shift.getEndTime();
        this.breakStartTime = shift.getBreakStartTime();
        this.breakEndTime = shift.getBreakEndTime();
    }
}
