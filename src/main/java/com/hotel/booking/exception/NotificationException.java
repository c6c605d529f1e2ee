package com.hotel.booking.exception;

/**
 * Notification delivery failure. Always non-fatal: logged, never propagated
 * to the caller of a booking operation.
 */
public class NotificationException extends BookingException {

    public NotificationException(String message, Throwable cause) {
        super(ErrorType.NOTIFICATION_ERROR, message, false, cause);
    }
}
