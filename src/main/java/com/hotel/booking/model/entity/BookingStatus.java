package com.hotel.booking.model.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Booking lifecycle states observable at rest (plus pending for providers that
 * confirm asynchronously). CANCELLED is terminal.
 */
public enum BookingStatus {
    PENDING("pending"),
    CONFIRMED("confirmed"),
    CANCELLED("cancelled");

    private final String value;

    BookingStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == CANCELLED;
    }
}
