package com.mealshift.orderservice.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class PersonSyncRequest {

    @Size(max = 200)
    private String displayName;

    private Boolean active;
}
