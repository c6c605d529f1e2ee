package com.hotel.booking.retry;

/**
 * Observation hook invoked before each backoff wait.
 */
@FunctionalInterface
public interface RetryListener {

    /**
     * @param error       failure of the attempt that just ran
     * @param retryNumber 1 for the first retry, 2 for the second, ...
     * @param delayMs     wait before the retry starts
     */
    void onRetry(Throwable error, int retryNumber, long delayMs);
}
