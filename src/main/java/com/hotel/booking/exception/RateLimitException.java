package com.hotel.booking.exception;

import com.hotel.booking.ratelimit.OperationClass;

import java.time.Instant;

/**
 * Raised when an identity exhausted its window for an operation class.
 *
 * Carries retryAfter (seconds) and resetAt so the caller can surface a precise
 * wait time (HTTP 429 semantics). Never retried internally.
 */
public class RateLimitException extends BookingException {

    private final OperationClass operationClass;
    private final long retryAfterSeconds;
    private final Instant resetAt;

    public RateLimitException(String message, OperationClass operationClass, long retryAfterSeconds,
            Instant resetAt) {
        super(ErrorType.RATE_LIMIT_ERROR, message, false);
        this.operationClass = operationClass;
        this.retryAfterSeconds = retryAfterSeconds;
        this.resetAt = resetAt;
    }

    public OperationClass getOperationClass() {
        return operationClass;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public Instant getResetAt() {
        return resetAt;
    }
}
