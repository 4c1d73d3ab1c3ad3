package com.mealshift.orderservice.dto;

import com.mealshift.orderservice.exception.RejectionReason;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class BulkOrderFailure {
    LocalDate orderDate;
    UUID shiftId;
    RejectionReason reason;
    String message;
}
