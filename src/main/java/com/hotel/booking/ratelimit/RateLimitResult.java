package com.hotel.booking.ratelimit;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of a rate-limit check.
 * - retryAfterSeconds is null when the request was allowed
 */
@Value
@Builder
public class RateLimitResult {
    boolean allowed;
    int limit;
    int remaining;
    Instant resetAt;
    Long retryAfterSeconds;
}
