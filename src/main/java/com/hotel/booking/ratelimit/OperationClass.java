package com.hotel.booking.ratelimit;

/**
 * Operation classes limited independently of each other.
 */
public enum OperationClass {
    AVAILABILITY("availability"),
    BOOKING("booking"),
    MODIFICATION("modification"),
    CANCELLATION("cancellation");

    private final String value;

    OperationClass(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
