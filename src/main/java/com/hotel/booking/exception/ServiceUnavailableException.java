package com.hotel.booking.exception;

/**
 * Custom exception for service unavailability scenarios
 *
 * WHEN THROWN:
 * - A provider's circuit breaker is OPEN and the call was not permitted
 *
 * EXTENDS ProviderException:
 * - Counts as a provider failure, so the RetryPolicy may try again once the
 * breaker lets calls through
 * - Mapped to HTTP 503 (Service Unavailable)
 */
public class ServiceUnavailableException extends ProviderException {
    public ServiceUnavailableException(String providerId, String message) {
        super(providerId, message);
    }
}
