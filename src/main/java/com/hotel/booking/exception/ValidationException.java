package com.hotel.booking.exception;

import java.util.List;

/**
 * Malformed or malicious input, or a structural date error.
 *
 * WHEN THROWN:
 * - Injection patterns detected in a booking request
 * - Required fields missing, check-in in the past, check-out not after check-in
 * - Pricing requested for a room the availability lookup did not return
 * - Modifying or cancelling a booking that is already cancelled
 *
 * Never retried; mapped to HTTP 400.
 */
public class ValidationException extends BookingException {

    private final List<String> violations;

    public ValidationException(String message) {
        this(message, List.of(message));
    }

    public ValidationException(String message, List<String> violations) {
        super(ErrorType.VALIDATION_ERROR, message, false);
        this.violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public static ValidationException of(List<String> violations) {
        return new ValidationException(String.join(", ", violations), violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
