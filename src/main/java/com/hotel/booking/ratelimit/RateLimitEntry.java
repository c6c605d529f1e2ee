package com.hotel.booking.ratelimit;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

/**
 * Counter for one identity inside one fixed window. Mutated only by its owning
 * RateLimiter.
 */
@Data
@AllArgsConstructor
public class RateLimitEntry {
    private int count;
    private Instant windowResetAt;
    private Instant firstRequestAt;

    public boolean isExpired(Instant now) {
        return !now.isBefore(windowResetAt);
    }
}
