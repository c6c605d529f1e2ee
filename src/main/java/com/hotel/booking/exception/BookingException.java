package com.hotel.booking.exception;

/**
 * Base type for every failure raised by the booking orchestration layer.
 *
 * EXTENDS RuntimeException:
 * - Unchecked, so it flows through Vert.x Future failures and lambdas without
 * wrapping
 * - Carries an ErrorType so callers (controller, retry predicate) can branch
 * without instanceof chains
 *
 * RETRYABLE:
 * - Only provider failures are retryable; validation, rate-limit, payment and
 * not-found failures surface immediately
 */
public abstract class BookingException extends RuntimeException {

    private final ErrorType errorType;
    private final boolean retryable;

    protected BookingException(ErrorType errorType, String message, boolean retryable) {
        super(message);
        this.errorType = errorType;
        this.retryable = retryable;
    }

    protected BookingException(ErrorType errorType, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.retryable = retryable;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
