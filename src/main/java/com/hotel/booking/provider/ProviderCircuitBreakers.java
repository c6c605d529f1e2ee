package com.hotel.booking.provider;

import com.hotel.booking.exception.BookingException;
import com.hotel.booking.exception.ProviderException;
import com.hotel.booking.exception.ServiceUnavailableException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * One Resilience4j circuit breaker per provider, named "provider-{providerId}".
 *
 * MANUAL CIRCUIT BREAKER (no @CircuitBreaker annotation):
 * --Provider calls return Vert.x Futures; the AOP proxy would only see the
 * Future being handed back, never its outcome
 * --Solution: tryAcquirePermission() before the call, onSuccess()/onError()
 * with the measured duration once the Future completes
 * =========
 * OUTCOMES:
 * --Rejected call: failed Future with ServiceUnavailableException
 * --Non-retryable booking errors (validation, not found) count as successful
 * calls: the provider answered
 * --Any other failure counts as an error and is surfaced as ProviderException
 */
@Component
@Slf4j
public class ProviderCircuitBreakers {

    private static final String PREFIX = "provider-";

    private final CircuitBreakerRegistry circuitBreakerRegistry;

    @Autowired
    public ProviderCircuitBreakers(CircuitBreakerRegistry circuitBreakerRegistry) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
    }

    public CircuitBreaker forProvider(String providerId) {
        return circuitBreakerRegistry.circuitBreaker(PREFIX + providerId);
    }

    public <T> Future<T> execute(String providerId, String operation, Supplier<Future<T>> call) {
        CircuitBreaker circuitBreaker = forProvider(providerId);
        log.debug("[CB-BEFORE] {} {} | State: {}", providerId, operation, circuitBreaker.getState());

        if (!circuitBreaker.tryAcquirePermission()) {
            log.warn("[CB-REJECTED] Circuit is OPEN for provider {} - {} not attempted", providerId, operation);
            return Future.failedFuture(new ServiceUnavailableException(providerId,
                    "Provider " + providerId + " is temporarily unavailable"));
        }

        long start = System.nanoTime();
        Future<T> result;
        try {
            result = call.get();
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }

        return result
                .onSuccess(value -> circuitBreaker.onSuccess(System.nanoTime() - start, TimeUnit.NANOSECONDS))
                .recover(error -> {
                    long duration = System.nanoTime() - start;
                    if (error instanceof BookingException && !((BookingException) error).isRetryable()) {
                        circuitBreaker.onSuccess(duration, TimeUnit.NANOSECONDS);
                        return Future.failedFuture(error);
                    }
                    circuitBreaker.onError(duration, TimeUnit.NANOSECONDS, error);
                    if (error instanceof ProviderException) {
                        return Future.failedFuture(error);
                    }
                    log.error("Provider {} failed during {}: {}", providerId, operation, error.getMessage());
                    return Future.failedFuture(new ProviderException(providerId,
                            "Provider " + providerId + " failed during " + operation + ": " + error.getMessage(),
                            error));
                });
    }
}
