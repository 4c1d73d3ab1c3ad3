package com.mealshift.orderservice.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

@Data
public class BulkOrderRequest {

    public static final int MAX_ITEMS = 30;

    @NotEmpty(message = "At least one order is required")
    @Size(max = MAX_ITEMS, message = "At most " + MAX_ITEMS + " orders per request")
    @Valid
    private List<OrderRequest> orders;
}
