package com.hotel.booking.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * -@Component: Registers this class as a Spring-managed bean.
 * --Allows injection of booking settings into services and config classes
 * --WithoutIT: [@ConfigurationProperties] alone won't register the bean;
 * ---services requiring BookingProperties would fail to start.
 * =========
 * -@ConfigurationProperties: Binds properties with prefix "booking" from
 * application.yml.
 * --Nested objects bind to nested yml keys (booking.cache.availability-ttl)
 * --Durations accept "5m", "10s", "1h" or plain milliseconds
 * --WithoutIT: Every setting below would stay at its default value.
 * =========
 * -@Data: Lombok getters/setters required by the binder.
 *
 * Defaults mirror the production values so components can be constructed
 * directly in tests with {@code new BookingProperties()}.
 */
@Component
@ConfigurationProperties(prefix = "booking")
@Data
public class BookingProperties {

    private Cache cache = new Cache();
    private RateLimits rateLimits = new RateLimits();
    private Retry retry = new Retry();
    private Pricing pricing = new Pricing();

    // Extra charge applied on top of the price difference when a stay changes
    private BigDecimal modificationFee = BigDecimal.ZERO;

    // Zone used to count days until check-in
    private String zone = "UTC";

    @Data
    public static class Cache {
        private Duration availabilityTtl = Duration.ofMinutes(5);
        private Duration pricingTtl = Duration.ofMinutes(5);
        private Duration cleanupInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class RateLimits {
        private Window availability = new Window(20, Duration.ofMinutes(1));
        private Window booking = new Window(5, Duration.ofMinutes(10));
        private Window modification = new Window(3, Duration.ofHours(1));
        private Window cancellation = new Window(3, Duration.ofHours(1));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Window {
        private int maxRequests;
        private Duration window;
    }

    @Data
    public static class Retry {
        // Switches availability lookups to the slow-network settings
        private boolean slowNetwork = false;
        private Duration maxDelay = Duration.ofSeconds(10);
        private boolean jitter = false;
        private Attempts availability = new Attempts(3, Duration.ofMillis(1000));
        private Attempts slowNetworkAvailability = new Attempts(2, Duration.ofMillis(2000));
        private Attempts pricing = new Attempts(2, Duration.ofMillis(500));
        private Attempts reservation = new Attempts(2, Duration.ofMillis(1000));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Attempts {
        private int maxRetries;
        private Duration initialDelay;
    }

    @Data
    public static class Pricing {
        private String currency = "USD";
        private String taxName = "Hotel Tax";
        private BigDecimal taxRate = new BigDecimal("0.12");
        private String serviceFeeName = "Service Fee";
        private String serviceFeeDescription = "Booking service fee";
        private BigDecimal serviceFee = new BigDecimal("25");
        private Map<String, BigDecimal> exchangeRates = new LinkedHashMap<>();
    }
}
