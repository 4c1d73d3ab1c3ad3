package com.mealshift.orderservice.service;

import com.mealshift.orderservice.model.Restriction;
import lombok.Value;

import java.util.Optional;
import java.util.UUID;

/**
 * Outcome of one accrued strike.
 */
@Value
public class StrikeAccrual {

    UUID personId;
    int strikeCount;
    // set only when this strike opened a restriction
    Restriction openedRestriction;

    public boolean restrictionOpened() {
        return openedRestriction != null;
    }

    public Optional<Restriction> openedRestriction() {
        return Optional.ofNullable(openedRestriction);
    }
}
