package com.hotel.booking.exception;

/**
 * Payment confirmation or refund failure.
 *
 * Aborts a modification (nothing committed). Logged only when it happens as a
 * side effect of a cancellation, which must still succeed.
 */
public class PaymentException extends BookingException {

    public PaymentException(String message) {
        super(ErrorType.PAYMENT_ERROR, message, false);
    }

    public PaymentException(String message, Throwable cause) {
        super(ErrorType.PAYMENT_ERROR, message, false, cause);
    }
}
