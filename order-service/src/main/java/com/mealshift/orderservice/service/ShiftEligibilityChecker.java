package com.mealshift.orderservice.service;

import com.mealshift.orderservice.model.Shift;

import java.util.UUID;

/**
 * Organisational rule deciding whether a person may book a shift, e.g. by department.
 * Supplied by the directory integration.
 */
@FunctionalInterface
public interface ShiftEligibilityChecker {

    boolean isEligible(UUID personId, Shift shift);
}
