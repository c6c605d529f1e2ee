package com.hotel.booking.notification;

/**
 * Event bus addresses for booking lifecycle events.
 */
public final class BookingEvents {

    public static final String CONFIRMED = "booking.confirmed";
    public static final String MODIFIED = "booking.modified";
    public static final String CANCELLED = "booking.cancelled";

    private BookingEvents() {
    }
}
