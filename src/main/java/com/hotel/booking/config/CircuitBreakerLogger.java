package com.hotel.booking.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;

/**
 * Circuit Breaker Event Logger
 *
 * Logs state changes, rejections and failure-rate breaches of the
 * per-provider circuit breakers ("provider-{id}").
 */
/**
 * -@Component: Registers this class as a Spring component
 * --Enables automatic discovery during component scanning
 * =========
 * -@Slf4j: Lombok annotation for logger generation
 */
@Component
@Slf4j
public class CircuitBreakerLogger {

    /**
     * -@Autowired: Registry holding every provider circuit breaker
     */
    @Autowired
    private CircuitBreakerRegistry circuitBreakerRegistry;

    /**
     * -@PostConstruct: Attaches listeners to existing breakers and to every
     * breaker created later
     * --Provider breakers are created lazily on a provider's first call, so
     * registry entry events must be watched too
     */
    @PostConstruct
    public void registerEventListeners() {
        circuitBreakerRegistry.getAllCircuitBreakers().forEach(this::registerListeners);
        circuitBreakerRegistry.getEventPublisher()
                .onEntryAdded(event -> registerListeners(event.getAddedEntry()));
    }

    void registerListeners(CircuitBreaker circuitBreaker) {
        String cbName = circuitBreaker.getName();

        circuitBreaker.getEventPublisher().onError(event -> {
            CircuitBreaker.Metrics metrics = circuitBreaker.getMetrics();
            log.warn("[{}] ERROR | State: {} | Failures: {}/{} | Failure Rate: {}% | Error: {}",
                    cbName,
                    circuitBreaker.getState(),
                    metrics.getNumberOfFailedCalls(),
                    metrics.getNumberOfBufferedCalls(),
                    String.format("%.2f", metrics.getFailureRate()),
                    event.getThrowable().getClass().getSimpleName());
        });

        circuitBreaker.getEventPublisher().onFailureRateExceeded(event -> {
            log.warn("[{}] FAILURE RATE EXCEEDED! Current: {}%, Threshold: {}%",
                    cbName,
                    String.format("%.2f", event.getFailureRate()),
                    String.format("%.2f", circuitBreaker.getCircuitBreakerConfig().getFailureRateThreshold()));
        });

        // CLOSED -> OPEN -> HALF_OPEN
        circuitBreaker.getEventPublisher().onStateTransition(event -> {
            log.warn("[{}] STATE TRANSITION: {} -> {}",
                    cbName,
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState());
            logDetailedMetrics(circuitBreaker);
        });

        circuitBreaker.getEventPublisher().onCallNotPermitted(event -> {
            log.warn("[{}] CALL REJECTED - Circuit is OPEN", cbName);
        });
        log.info("Circuit breaker listeners attached to {}", cbName);
    }

    private void logDetailedMetrics(CircuitBreaker circuitBreaker) {
        CircuitBreaker.Metrics metrics = circuitBreaker.getMetrics();
        var config = circuitBreaker.getCircuitBreakerConfig();

        log.warn("[{}] DETAILED METRICS:", circuitBreaker.getName());
        log.warn("   Buffered Calls: {}", metrics.getNumberOfBufferedCalls());
        log.warn("   Failed Calls: {}", metrics.getNumberOfFailedCalls());
        log.warn("   Not Permitted: {}", metrics.getNumberOfNotPermittedCalls());
        log.warn("   Failure Rate: {}%", String.format("%.2f", metrics.getFailureRate()));
        log.warn("   Config - Sliding Window Size: {}", config.getSlidingWindowSize());
        log.warn("   Config - Min Calls: {}", config.getMinimumNumberOfCalls());
        log.warn("   Config - Failure Threshold: {}%", config.getFailureRateThreshold());
    }
}
