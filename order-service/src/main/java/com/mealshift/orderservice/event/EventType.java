package com.mealshift.orderservice.event;

/**
 * Fixed vocabulary of events pushed to connected observers.
 */
public enum EventType {
    ORDER_CREATED("order.created"),
    ORDER_CHECKIN("order.checkin"),
    ORDER_CANCELLED("order.cancelled"),
    ORDER_NOSHOW("order.noshow"),
    USER_BLACKLISTED("user.blacklisted"),
    USER_UNBLOCKED("user.unblocked"),
    USER_STRIKES_RESET("user.strikesReset"),
    POLICY_UPDATED("policy.updated"),
    SHIFT_UPDATED("shift.updated"),
    HOLIDAY_UPDATED("holiday.updated");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
