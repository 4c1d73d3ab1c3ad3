package com.mealshift.orderservice.dto;

import com.mealshift.orderservice.model.CutoffMode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.DayOfWeek;
import java.util.Set;

/**
 * Partial update: null fields keep their current value.
 */
@Data
public class PolicyUpdateRequest {

    private CutoffMode cutoffMode;

    @Min(0)
    @Max(30)
    private Integer cutoffDays;

    @Min(0)
    @Max(24)
    private Integer cutoffLeadHours;

    private DayOfWeek weeklyCutoffDay;

    @Min(0)
    @Max(23)
    private Integer weeklyCutoffHour;

    @Min(0)
    @Max(59)
    private Integer weeklyCutoffMinute;

    @Size(min = 1)
    private Set<DayOfWeek> orderableDays;

    @Min(1)
    @Max(4)
    private Integer maxWeeksAhead;

    @Min(1)
    private Integer strikeThreshold;

    @Min(1)
    private Integer restrictionDurationDays;

    @Min(0)
    @Max(30)
    private Integer bookingHorizonDays;

    private Boolean lateCancellationAllowed;

    @Min(0)
    @Max(240)
    private Integer earlyCollectionMinutes;

    @Min(0)
    @Max(240)
    private Integer collectionGraceMinutes;
}
