package com.hotel.booking.payment;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PaymentStatus {
    REQUIRES_CONFIRMATION("requires_confirmation"),
    SUCCEEDED("succeeded"),
    FAILED("failed");

    private final String value;

    PaymentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
