package com.hotel.booking.ratelimit;

import com.hotel.booking.exception.RateLimitException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-window request counter keyed by caller identity.
 *
 * WINDOW SEMANTICS:
 * - First request of an identity opens a window of windowMs and counts 1
 * - Once now >= windowResetAt the window is replaced by a fresh one
 * - Inside the window requests count up to maxRequests; further ones are
 * denied until the window resets
 * - A burst straddling a window boundary can reach twice maxRequests; the
 * limiter stays fixed-window
 *
 * Each operation class gets its own instance (see RateLimiters), so a denial
 * in one class never affects another.
 */
@Slf4j
public class RateLimiter {

    private final OperationClass operationClass;
    private final int maxRequests;
    private final Duration window;
    private final Clock clock;
    private final Map<String, RateLimitEntry> entries = new ConcurrentHashMap<>();

    public RateLimiter(OperationClass operationClass, int maxRequests, Duration window, Clock clock) {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.operationClass = operationClass;
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = clock;
    }

    public RateLimitResult check(String identity) {
        Instant now = clock.instant();
        boolean[] allowed = new boolean[1];
        // compute() serializes concurrent checks for the same identity
        RateLimitEntry entry = entries.compute(identity, (id, current) -> {
            if (current == null || current.isExpired(now)) {
                allowed[0] = true;
                return new RateLimitEntry(1, now.plus(window), now);
            }
            if (current.getCount() < maxRequests) {
                current.setCount(current.getCount() + 1);
                allowed[0] = true;
            }
            return current;
        });

        if (allowed[0]) {
            return RateLimitResult.builder()
                    .allowed(true)
                    .limit(maxRequests)
                    .remaining(maxRequests - entry.getCount())
                    .resetAt(entry.getWindowResetAt())
                    .build();
        }

        long retryAfter = ceilSeconds(Duration.between(now, entry.getWindowResetAt()));
        log.warn("Rate limit exceeded for {} [{}], retry after {}s", identity, operationClass.getValue(),
                retryAfter);
        return RateLimitResult.builder()
                .allowed(false)
                .limit(maxRequests)
                .remaining(0)
                .resetAt(entry.getWindowResetAt())
                .retryAfterSeconds(retryAfter)
                .build();
    }

    /**
     * Same as check, but raises RateLimitException on denial.
     */
    public RateLimitResult enforce(String identity) {
        RateLimitResult result = check(identity);
        if (!result.isAllowed()) {
            long minutes = Math.max(1, (result.getRetryAfterSeconds() + 59) / 60);
            throw new RateLimitException(
                    "Rate limit exceeded. Please try again in " + minutes + " minute(s).",
                    operationClass, result.getRetryAfterSeconds(), result.getResetAt());
        }
        return result;
    }

    public void reset(String identity) {
        entries.remove(identity);
    }

    public void clear() {
        entries.clear();
    }

    /**
     * Requests counted in the current window; 0 once the window elapsed. Never
     * mutates state.
     */
    public int getCount(String identity) {
        RateLimitEntry entry = entries.get(identity);
        if (entry == null || entry.isExpired(clock.instant())) {
            return 0;
        }
        return entry.getCount();
    }

    /**
     * X-RateLimit-* headers for a result; Retry-After only on denial.
     */
    public Map<String, String> headers(RateLimitResult result) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-RateLimit-Limit", String.valueOf(maxRequests));
        headers.put("X-RateLimit-Remaining", String.valueOf(result.getRemaining()));
        headers.put("X-RateLimit-Reset", String.valueOf(result.getResetAt().getEpochSecond()));
        if (!result.isAllowed() && result.getRetryAfterSeconds() != null) {
            headers.put("Retry-After", String.valueOf(result.getRetryAfterSeconds()));
        }
        return headers;
    }

    public OperationClass getOperationClass() {
        return operationClass;
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public Duration getWindow() {
        return window;
    }

    private static long ceilSeconds(Duration duration) {
        long millis = Math.max(0, duration.toMillis());
        return (millis + 999) / 1000;
    }
}
