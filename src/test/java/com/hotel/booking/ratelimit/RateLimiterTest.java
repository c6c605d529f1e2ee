package com.hotel.booking.ratelimit;

import com.hotel.booking.config.BookingProperties;
import com.hotel.booking.exception.RateLimitException;
import com.hotel.booking.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TestCategory: Unit Test - Fixed-window rate limiting
 */
class RateLimiterTest {

    private static final Instant START = Instant.parse("2030-01-01T10:00:00Z");

    private MutableClock clock;
    private RateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        limiter = new RateLimiter(OperationClass.BOOKING, 5, Duration.ofMinutes(10), clock);
    }

    /**
     * Input: 6 checks for the same identity inside one window
     * ExpectedOut: first 5 allowed with remaining 4..0, 6th denied with
     * retryAfter = 600s
     */
    @Test
    void testCheck_DeniesAfterMaxRequests() {
        // When / Then
        for (int i = 1; i <= 5; i++) {
            RateLimitResult result = limiter.check("user-1");
            assertTrue(result.isAllowed(), "request " + i);
            assertEquals(5 - i, result.getRemaining());
            assertNull(result.getRetryAfterSeconds());
        }
        RateLimitResult denied = limiter.check("user-1");

        assertFalse(denied.isAllowed());
        assertEquals(0, denied.getRemaining());
        assertEquals(600L, denied.getRetryAfterSeconds());
        assertEquals(START.plus(Duration.ofMinutes(10)), denied.getResetAt());
        assertEquals(5, limiter.getCount("user-1"), "denied requests are not counted");
    }

    /**
     * Input: window exhausted, clock moved to windowResetAt
     * ExpectedOut: next request opens a fresh window with count 1
     */
    @Test
    void testCheck_WindowResets() {
        for (int i = 0; i < 5; i++) {
            limiter.check("user-1");
        }
        assertFalse(limiter.check("user-1").isAllowed());

        clock.advance(Duration.ofMinutes(10));

        RateLimitResult result = limiter.check("user-1");
        assertTrue(result.isAllowed());
        assertEquals(4, result.getRemaining());
        assertEquals(1, limiter.getCount("user-1"));
    }

    @Test
    void testCheck_IdentitiesAreIndependent() {
        for (int i = 0; i < 5; i++) {
            limiter.check("user-1");
        }

        assertFalse(limiter.check("user-1").isAllowed());
        assertTrue(limiter.check("user-2").isAllowed());
    }

    /**
     * Input: denial 90.5 seconds before the window resets
     * ExpectedOut: retryAfter rounds up to 91s, message says 2 minute(s)
     */
    @Test
    void testEnforce_ThrowsWithRetryAfter() {
        for (int i = 0; i < 5; i++) {
            limiter.enforce("user-1");
        }
        clock.advance(Duration.ofMinutes(10).minusMillis(90_500));

        RateLimitException ex = assertThrows(RateLimitException.class, () -> limiter.enforce("user-1"));

        assertEquals(91L, ex.getRetryAfterSeconds());
        assertEquals(OperationClass.BOOKING, ex.getOperationClass());
        assertEquals("Rate limit exceeded. Please try again in 2 minute(s).", ex.getMessage());
        assertFalse(ex.isRetryable());
    }

    @Test
    void testGetCount_ZeroAfterExpiryWithoutMutation() {
        limiter.check("user-1");
        clock.advance(Duration.ofMinutes(11));

        assertEquals(0, limiter.getCount("user-1"));
        assertEquals(0, limiter.getCount("unknown"));
    }

    @Test
    void testReset_ClearsIdentity() {
        for (int i = 0; i < 5; i++) {
            limiter.check("user-1");
        }

        limiter.reset("user-1");

        assertTrue(limiter.check("user-1").isAllowed());
    }

    @Test
    void testClear_ForgetsAllIdentities() {
        limiter.check("user-1");
        limiter.check("user-2");

        limiter.clear();

        assertEquals(0, limiter.getCount("user-1"));
        assertEquals(0, limiter.getCount("user-2"));
    }

    @Test
    void testHeaders_RetryAfterOnlyWhenDenied() {
        RateLimitResult allowed = limiter.check("user-1");
        for (int i = 0; i < 4; i++) {
            limiter.check("user-1");
        }
        RateLimitResult denied = limiter.check("user-1");

        Map<String, String> allowedHeaders = limiter.headers(allowed);
        Map<String, String> deniedHeaders = limiter.headers(denied);

        assertEquals("5", allowedHeaders.get("X-RateLimit-Limit"));
        assertEquals("4", allowedHeaders.get("X-RateLimit-Remaining"));
        assertEquals(String.valueOf(START.plus(Duration.ofMinutes(10)).getEpochSecond()),
                allowedHeaders.get("X-RateLimit-Reset"));
        assertFalse(allowedHeaders.containsKey("Retry-After"));
        assertEquals("600", deniedHeaders.get("Retry-After"));
    }

    @Test
    void testConstructor_RejectsInvalidConfig() {
        assertThrows(IllegalArgumentException.class,
                () -> new RateLimiter(OperationClass.BOOKING, 0, Duration.ofMinutes(1), clock));
        assertThrows(IllegalArgumentException.class,
                () -> new RateLimiter(OperationClass.BOOKING, 1, Duration.ZERO, clock));
    }

    /**
     * Input: default limits, availability exhausted
     * ExpectedOut: booking class still allowed for the same identity
     */
    @Test
    void testRateLimiters_ClassesAreIndependent() {
        RateLimiters limiters = new RateLimiters(new BookingProperties().getRateLimits(), clock);
        for (int i = 0; i < 20; i++) {
            limiters.enforce(OperationClass.AVAILABILITY, "user-1");
        }

        assertThrows(RateLimitException.class, () -> limiters.enforce(OperationClass.AVAILABILITY, "user-1"));
        assertTrue(limiters.enforce(OperationClass.BOOKING, "user-1").isAllowed());
        assertEquals(3, limiters.get(OperationClass.CANCELLATION).getMaxRequests());
        assertEquals(Duration.ofHours(1), limiters.get(OperationClass.MODIFICATION).getWindow());

        limiters.clearAll();
        assertTrue(limiters.enforce(OperationClass.AVAILABILITY, "user-1").isAllowed());
    }
}
