package com.mealshift.orderservice.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a bulk order: each item is either created or listed with the reason it was refused.
 */
@Value
@Builder
public class BulkOrderResponse {
    List<OrderResponse> created;
    List<BulkOrderFailure> failed;
}
