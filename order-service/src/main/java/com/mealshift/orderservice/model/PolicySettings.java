package com.mealshift.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.UUID;

/**
 * Persisted form of the engine policy. There is a single row with id {@code default}.
 */
@Entity
@Table(name = "policy_settings")
@Getter
@Setter
public class PolicySettings {

    public static final String DEFAULT_ID = "default";

    @Id
    @Column(length = 32)
    private String id = DEFAULT_ID;

    @Enumerated(EnumType.STRING)
    @Column(name = "cutoff_mode", nullable = false, length = 20)
    private CutoffMode cutoffMode = CutoffMode.PER_SHIFT;

    @Column(name = "cutoff_days", nullable = false)
    private int cutoffDays;

    @Column(name = "cutoff_lead_hours", nullable = false)
    private int cutoffLeadHours;

    @Enumerated(EnumType.STRING)
    @Column(name = "weekly_cutoff_day", length = 10)
    private DayOfWeek weeklyCutoffDay;

    @Column(name = "weekly_cutoff_hour", nullable = false)
    private int weeklyCutoffHour;

    @Column(name = "weekly_cutoff_minute", nullable = false)
    private int weeklyCutoffMinute;

    // ISO day numbers, e.g. "1,2,3,4,5,6" for Monday to Saturday
    @Column(name = "orderable_days", length = 20)
    private String orderableDays;

    @Column(name = "max_weeks_ahead", nullable = false)
    private int maxWeeksAhead;

    @Column(name = "strike_threshold", nullable = false)
    private int strikeThreshold;

    @Column(name = "restriction_duration_days", nullable = false)
    private int restrictionDurationDays;

    @Column(name = "booking_horizon_days", nullable = false)
    private int bookingHorizonDays;

    @Column(name = "late_cancellation_allowed", nullable = false)
    private boolean lateCancellationAllowed;

    @Column(name = "early_collection_minutes", nullable = false)
    private int earlyCollectionMinutes;

    @Column(name = "collection_grace_minutes", nullable = false)
    private int collectionGraceMinutes;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "updated_by")
    private UUID updatedBy;

    @Version
    @Column(name = "version")
    private Long version;
}
