package com.hotel.booking.exception;

/**
 * Failure taxonomy shared by every booking operation.
 */
public enum ErrorType {
    VALIDATION_ERROR,
    RATE_LIMIT_ERROR,
    PROVIDER_ERROR,
    PAYMENT_ERROR,
    NOTIFICATION_ERROR,
    NOT_FOUND
}
