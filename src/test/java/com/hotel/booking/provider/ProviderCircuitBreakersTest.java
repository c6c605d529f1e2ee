package com.hotel.booking.provider;

import com.hotel.booking.exception.ProviderException;
import com.hotel.booking.exception.ServiceUnavailableException;
import com.hotel.booking.exception.ValidationException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.vertx.core.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TestCategory: Unit Test - Circuit Breaker Behavior
 *
 * Real Resilience4j registry with a small count-based window:
 * - 4 calls, 50% failure rate opens the circuit
 * - open circuit rejects without invoking the provider
 * - non-retryable errors (provider answered) do not count as failures
 */
class ProviderCircuitBreakersTest {

    private ProviderCircuitBreakers circuitBreakers;

    @BeforeEach
    void setUp() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(4)
                .minimumNumberOfCalls(4)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofMinutes(1))
                .build();
        circuitBreakers = new ProviderCircuitBreakers(CircuitBreakerRegistry.of(config));
    }

    @Test
    void testExecute_SuccessPassesThrough() {
        Future<String> result = circuitBreakers.execute("expedia", "checkAvailability",
                () -> Future.succeededFuture("rooms"));

        assertTrue(result.succeeded());
        assertEquals("rooms", result.result());
        assertEquals("provider-expedia", circuitBreakers.forProvider("expedia").getName());
    }

    /**
     * Phase 1: 4 transient failures -> circuit OPEN
     * Phase 2: next call rejected with ServiceUnavailableException, provider
     * not invoked
     */
    @Test
    void testExecute_OpensAfterFailuresAndRejects() {
        // Given
        AtomicInteger invocations = new AtomicInteger();
        for (int i = 0; i < 4; i++) {
            circuitBreakers.execute("expedia", "createReservation", () -> {
                invocations.incrementAndGet();
                return Future.failedFuture(new RuntimeException("connection reset"));
            });
        }

        // When
        Future<String> rejected = circuitBreakers.execute("expedia", "createReservation", () -> {
            invocations.incrementAndGet();
            return Future.succeededFuture("never");
        });

        // Then
        assertEquals(CircuitBreaker.State.OPEN, circuitBreakers.forProvider("expedia").getState());
        assertTrue(rejected.failed());
        assertInstanceOf(ServiceUnavailableException.class, rejected.cause());
        assertEquals(4, invocations.get());
    }

    /**
     * Input: generic failure from the provider
     * ExpectedOut: wrapped as ProviderException carrying the provider id
     */
    @Test
    void testExecute_WrapsUnknownErrors() {
        Future<String> result = circuitBreakers.execute("expedia", "cancelReservation",
                () -> Future.failedFuture(new IllegalStateException("timeout")));

        assertTrue(result.failed());
        ProviderException error = assertInstanceOf(ProviderException.class, result.cause());
        assertEquals("expedia", error.getProviderId());
        assertTrue(error.isRetryable());
    }

    @Test
    void testExecute_NonRetryableErrorsKeepCircuitClosed() {
        for (int i = 0; i < 6; i++) {
            Future<String> result = circuitBreakers.execute("expedia", "createReservation",
                    () -> Future.failedFuture(new ValidationException("Room not available: room-1-1")));
            assertInstanceOf(ValidationException.class, result.cause());
        }

        assertEquals(CircuitBreaker.State.CLOSED, circuitBreakers.forProvider("expedia").getState());
    }

    @Test
    void testExecute_BreakersArePerProvider() {
        for (int i = 0; i < 4; i++) {
            circuitBreakers.execute("expedia", "checkAvailability",
                    () -> Future.failedFuture(new ProviderException("expedia", "down")));
        }

        Future<String> other = circuitBreakers.execute("booking-com", "checkAvailability",
                () -> Future.succeededFuture("ok"));

        assertEquals(CircuitBreaker.State.OPEN, circuitBreakers.forProvider("expedia").getState());
        assertTrue(other.succeeded());
    }

    @Test
    void testExecute_SynchronousThrowCountsAsFailure() {
        Future<String> result = circuitBreakers.execute("expedia", "getHotelDetails", () -> {
            throw new IllegalStateException("client not initialised");
        });

        assertInstanceOf(ProviderException.class, result.cause());
        assertEquals(1, circuitBreakers.forProvider("expedia").getMetrics().getNumberOfFailedCalls());
    }
}
