package com.mealshift.orderservice.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class NoShowNotice {
    private OrderResponse order;
    private int strikeCount;
    private boolean restrictionOpened;
}
