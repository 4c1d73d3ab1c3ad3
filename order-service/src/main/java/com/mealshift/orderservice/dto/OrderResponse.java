package com.mealshift.orderservice.dto;

import com.mealshift.orderservice.model.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResponse {
    private UUID id;
    private UUID personId;
    private UUID shiftId;
    private LocalDate orderDate;
    private OrderStatus status;
    private String pickupCode;
    private Instant createdAt;
    private Instant collectedAt;
    private UUID collectedBy;
    private String collectionPoint;
    private Instant cancelledAt;
    private UUID cancelledBy;
    private String cancelReason;
    private boolean lateCancellation;
    private Instant notCollectedAt;
}
