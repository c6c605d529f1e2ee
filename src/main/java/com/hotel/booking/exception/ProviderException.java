package com.hotel.booking.exception;

/**
 * Transient failure of an external inventory/reservation provider.
 *
 * Retried by the RetryPolicy up to its configured limit, then surfaced
 * (HTTP 503).
 */
public class ProviderException extends BookingException {

    private final String providerId;

    public ProviderException(String providerId, String message) {
        super(ErrorType.PROVIDER_ERROR, message, true);
        this.providerId = providerId;
    }

    public ProviderException(String providerId, String message, Throwable cause) {
        super(ErrorType.PROVIDER_ERROR, message, true, cause);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }
}
