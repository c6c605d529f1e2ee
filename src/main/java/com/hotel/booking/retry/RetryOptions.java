package com.hotel.booking.retry;

import lombok.Builder;
import lombok.Value;

import java.util.function.BiPredicate;

/**
 * Per-call retry settings.
 * - maxRetries: retries after the first attempt (total attempts = maxRetries + 1)
 * - initialDelayMs: wait before the first retry, doubled for each further one
 * - maxDelayMs: upper bound on a single wait, null for unbounded
 * - jitter: adds up to 10% random delay on top of each wait
 * - shouldRetry: receives the error and the zero-based attempt index; false
 * propagates the error immediately
 */
@Value
@Builder(toBuilder = true)
public class RetryOptions {

    int maxRetries;
    long initialDelayMs;
    Long maxDelayMs;

    @Builder.Default
    boolean jitter = false;

    @Builder.Default
    BiPredicate<Throwable, Integer> shouldRetry = (error, attempt) -> true;

    RetryListener onRetry;

    public static RetryOptions of(int maxRetries, long initialDelayMs) {
        return RetryOptions.builder().maxRetries(maxRetries).initialDelayMs(initialDelayMs).build();
    }
}
