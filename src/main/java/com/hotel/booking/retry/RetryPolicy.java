package com.hotel.booking.retry;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Exponential-backoff retry executor for asynchronous operations.
 *
 * -@Component: Shared, stateless; each call carries its own RetryOptions.
 * =========
 * BEHAVIOUR:
 * - Runs the operation up to maxRetries + 1 times
 * - Wait before retry n (n >= 1) is initialDelay * 2^(n-1), capped by maxDelay
 * - Waits are Vert.x timers, no thread is blocked
 * - An operation that throws instead of returning a failed Future counts as a
 * failed attempt
 * - After the last attempt the last error propagates unchanged
 * - No deadline of its own: timeouts belong to the wrapped call
 */
@Component
@Slf4j
public class RetryPolicy {

    private static final double MULTIPLIER = 2.0;
    private static final double JITTER_FACTOR = 0.1;

    private final Vertx vertx;

    @Autowired
    public RetryPolicy(Vertx vertx) {
        this.vertx = vertx;
    }

    public <T> Future<T> retryWithBackoff(Supplier<Future<T>> operation, RetryOptions options) {
        Promise<T> promise = Promise.promise();
        attempt(operation, options, 0, promise);
        return promise.future();
    }

    /**
     * Wait before the retry that follows attempt index {@code attempt}
     * (zero-based).
     */
    public long backoffDelay(int attempt, RetryOptions options) {
        double delay = options.getInitialDelayMs() * Math.pow(MULTIPLIER, attempt);
        if (options.getMaxDelayMs() != null) {
            delay = Math.min(delay, options.getMaxDelayMs());
        }
        if (options.isJitter()) {
            delay += delay * JITTER_FACTOR * ThreadLocalRandom.current().nextDouble();
        }
        return (long) Math.floor(delay);
    }

    private <T> void attempt(Supplier<Future<T>> operation, RetryOptions options, int attempt, Promise<T> promise) {
        Future<T> result;
        try {
            result = operation.get();
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }

        result.onSuccess(promise::complete)
                .onFailure(error -> {
                    if (attempt >= options.getMaxRetries()) {
                        if (options.getMaxRetries() > 0) {
                            log.error("Giving up after {} attempts: {}", attempt + 1, error.getMessage());
                        }
                        promise.fail(error);
                        return;
                    }
                    if (!options.getShouldRetry().test(error, attempt)) {
                        log.debug("Not retrying {}: {}", error.getClass().getSimpleName(), error.getMessage());
                        promise.fail(error);
                        return;
                    }

                    long delay = backoffDelay(attempt, options);
                    notifyListener(options, error, attempt + 1, delay);
                    log.warn("Attempt {} failed ({}), retrying in {}ms", attempt + 1, error.getMessage(), delay);

                    if (delay <= 0) {
                        attempt(operation, options, attempt + 1, promise);
                    } else {
                        vertx.setTimer(delay, id -> attempt(operation, options, attempt + 1, promise));
                    }
                });
    }

    private void notifyListener(RetryOptions options, Throwable error, int retryNumber, long delay) {
        if (options.getOnRetry() == null) {
            return;
        }
        try {
            options.getOnRetry().onRetry(error, retryNumber, delay);
        } catch (RuntimeException e) {
            log.warn("Retry listener failed on retry {}: {}", retryNumber, e.getMessage());
        }
    }
}
