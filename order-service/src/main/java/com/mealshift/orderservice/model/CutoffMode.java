package com.mealshift.orderservice.model;

/**
 * How the ordering cutoff for a date is computed.
 */
public enum CutoffMode {
    // a fixed lead time before each shift starts
    PER_SHIFT,
    // once a week for the whole following week
    WEEKLY
}
