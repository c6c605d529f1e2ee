package com.hotel.booking.ratelimit;

import com.hotel.booking.config.BookingProperties;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

/**
 * Holder for the four independently configured limiters.
 */
public class RateLimiters {

    private final Map<OperationClass, RateLimiter> limiters = new EnumMap<>(OperationClass.class);

    public RateLimiters(BookingProperties.RateLimits config, Clock clock) {
        limiters.put(OperationClass.AVAILABILITY, create(OperationClass.AVAILABILITY, config.getAvailability(), clock));
        limiters.put(OperationClass.BOOKING, create(OperationClass.BOOKING, config.getBooking(), clock));
        limiters.put(OperationClass.MODIFICATION, create(OperationClass.MODIFICATION, config.getModification(), clock));
        limiters.put(OperationClass.CANCELLATION, create(OperationClass.CANCELLATION, config.getCancellation(), clock));
    }

    public RateLimiter get(OperationClass operationClass) {
        return limiters.get(operationClass);
    }

    public RateLimitResult enforce(OperationClass operationClass, String identity) {
        return get(operationClass).enforce(identity);
    }

    public void clearAll() {
        limiters.values().forEach(RateLimiter::clear);
    }

    private static RateLimiter create(OperationClass operationClass, BookingProperties.Window window, Clock clock) {
        return new RateLimiter(operationClass, window.getMaxRequests(), window.getWindow(), clock);
    }
}
