package com.hotel.booking.config;

import com.hotel.booking.provider.BookingProviderAdapter;
import com.hotel.booking.provider.InMemoryProviderAdapter;
import com.hotel.booking.provider.ProviderRegistry;
import com.hotel.booking.ratelimit.RateLimiters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * -@Configuration: Wiring for the orchestration core.
 * --Each store is an explicit bean rather than a static singleton, so tests
 * construct their own isolated copies
 * --WithoutIT: BookingOrchestrator has no clock, limiters or registry to
 * inject.
 */
@Configuration
@Slf4j
public class OrchestratorConfig {

    /**
     * -@Bean: System clock in UTC; tests substitute a controllable clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RateLimiters rateLimiters(BookingProperties properties, Clock clock) {
        return new RateLimiters(properties.getRateLimits(), clock);
    }

    /**
     * -@Bean: Provider registry with the in-memory adapter as fallback.
     * --Every other BookingProviderAdapter bean is registered after it, in bean
     * order
     */
    @Bean
    public ProviderRegistry providerRegistry(InMemoryProviderAdapter fallback,
            List<BookingProviderAdapter> adapters) {
        ProviderRegistry registry = new ProviderRegistry(fallback);
        adapters.stream()
                .filter(adapter -> adapter != fallback)
                .forEach(adapter -> registry.register(adapter.providerId(), adapter));
        log.info("Provider registry ready with {} provider(s)", registry.getAllProviders().size());
        return registry;
    }
}
