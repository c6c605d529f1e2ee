package com.hotel.booking.retry;

import com.hotel.booking.exception.ProviderException;
import com.hotel.booking.exception.ValidationException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * TestCategory: Unit Test - Exponential backoff retry
 *
 * Runs on a real Vert.x instance so waits go through Vert.x timers; delays are
 * kept to a few milliseconds.
 */
class RetryPolicyTest {

    private Vertx vertx;
    private RetryPolicy retryPolicy;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        retryPolicy = new RetryPolicy(vertx);
    }

    @AfterEach
    void tearDown() {
        vertx.close();
    }

    /**
     * Input: operation failing twice then succeeding, maxRetries 3
     * ExpectedOut: success after 3 attempts, listener sees retries 1 and 2 with
     * doubling delays
     */
    @Test
    void testRetryWithBackoff_SucceedsAfterFailures() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        List<Long> delays = new CopyOnWriteArrayList<>();
        List<Integer> retryNumbers = new CopyOnWriteArrayList<>();
        RetryOptions options = RetryOptions.of(3, 10).toBuilder()
                .onRetry((error, retryNumber, delayMs) -> {
                    retryNumbers.add(retryNumber);
                    delays.add(delayMs);
                })
                .build();

        // When
        Future<String> result = retryPolicy.retryWithBackoff(() -> calls.incrementAndGet() < 3
                ? Future.failedFuture(new ProviderException("p", "down"))
                : Future.succeededFuture("ok"), options);

        // Then
        await().atMost(Duration.ofSeconds(5)).until(result::isComplete);
        assertTrue(result.succeeded());
        assertEquals("ok", result.result());
        assertEquals(3, calls.get());
        assertEquals(List.of(1, 2), new ArrayList<>(retryNumbers));
        assertEquals(List.of(10L, 20L), new ArrayList<>(delays));
    }

    /**
     * Input: always-failing operation, maxRetries 2
     * ExpectedOut: exactly 3 attempts, last error propagated unchanged
     */
    @Test
    void testRetryWithBackoff_ExhaustsAndPropagatesLastError() {
        AtomicInteger calls = new AtomicInteger();

        Future<String> result = retryPolicy.retryWithBackoff(
                () -> Future.failedFuture(new ProviderException("p", "failure " + calls.incrementAndGet())),
                RetryOptions.of(2, 5));

        await().atMost(Duration.ofSeconds(5)).until(result::isComplete);
        assertTrue(result.failed());
        assertEquals(3, calls.get());
        assertInstanceOf(ProviderException.class, result.cause());
        assertEquals("failure 3", result.cause().getMessage());
    }

    /**
     * Input: shouldRetry refuses ValidationException
     * ExpectedOut: single attempt, no listener call
     */
    @Test
    void testRetryWithBackoff_ShouldRetryStopsImmediately() {
        AtomicInteger calls = new AtomicInteger();
        AtomicInteger listenerCalls = new AtomicInteger();
        RetryOptions options = RetryOptions.of(3, 5).toBuilder()
                .shouldRetry((error, attempt) -> !(error instanceof ValidationException))
                .onRetry((error, retryNumber, delayMs) -> listenerCalls.incrementAndGet())
                .build();

        Future<String> result = retryPolicy.retryWithBackoff(() -> {
            calls.incrementAndGet();
            return Future.failedFuture(new ValidationException("bad input"));
        }, options);

        await().atMost(Duration.ofSeconds(5)).until(result::isComplete);
        assertTrue(result.failed());
        assertEquals(1, calls.get());
        assertEquals(0, listenerCalls.get());
    }

    @Test
    void testRetryWithBackoff_ZeroRetriesRunsOnce() {
        AtomicInteger calls = new AtomicInteger();

        Future<String> result = retryPolicy.retryWithBackoff(() -> {
            calls.incrementAndGet();
            return Future.failedFuture(new ProviderException("p", "down"));
        }, RetryOptions.of(0, 5));

        await().atMost(Duration.ofSeconds(5)).until(result::isComplete);
        assertTrue(result.failed());
        assertEquals(1, calls.get());
    }

    /**
     * Input: operation that throws synchronously on the first call, listener
     * that throws
     * ExpectedOut: the throw counts as a failed attempt, the listener failure is
     * ignored
     */
    @Test
    void testRetryWithBackoff_SynchronousThrowAndFailingListener() {
        AtomicInteger calls = new AtomicInteger();
        RetryOptions options = RetryOptions.of(1, 5).toBuilder()
                .onRetry((error, retryNumber, delayMs) -> {
                    throw new IllegalStateException("listener broke");
                })
                .build();

        Future<String> result = retryPolicy.retryWithBackoff(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("boom");
            }
            return Future.succeededFuture("recovered");
        }, options);

        await().atMost(Duration.ofSeconds(5)).until(result::isComplete);
        assertTrue(result.succeeded());
        assertEquals("recovered", result.result());
        assertEquals(2, calls.get());
    }

    /**
     * Input: initialDelay 1000ms, maxDelay 3000ms
     * ExpectedOut: 1000, 2000, 3000 (capped), 3000
     */
    @Test
    void testBackoffDelay_DoublesAndCaps() {
        RetryOptions options = RetryOptions.of(5, 1000).toBuilder().maxDelayMs(3000L).build();

        assertEquals(1000, retryPolicy.backoffDelay(0, options));
        assertEquals(2000, retryPolicy.backoffDelay(1, options));
        assertEquals(3000, retryPolicy.backoffDelay(2, options));
        assertEquals(3000, retryPolicy.backoffDelay(3, options));
    }

    @Test
    void testBackoffDelay_JitterStaysWithinTenPercent() {
        RetryOptions options = RetryOptions.of(3, 1000).toBuilder().jitter(true).build();

        for (int i = 0; i < 50; i++) {
            long delay = retryPolicy.backoffDelay(1, options);
            assertTrue(delay >= 2000 && delay <= 2200, "delay " + delay);
        }
    }
}
