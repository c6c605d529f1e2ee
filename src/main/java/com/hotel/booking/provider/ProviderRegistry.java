package com.hotel.booking.provider;

import com.hotel.booking.model.entity.Hotel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes a hotel to the adapter of its backing system.
 *
 * RESOLUTION ORDER:
 * 1. hotel.providerId, when an adapter is registered under it
 * 2. first adapter, in registration order, whose supportsHotel(hotel) is true
 * 3. the fallback adapter, with a warning
 *
 * resolve() never throws and never caches: the table may change at runtime.
 */
@Slf4j
public class ProviderRegistry {

    private final Map<String, BookingProviderAdapter> adapters = new LinkedHashMap<>();
    private final BookingProviderAdapter fallback;

    public ProviderRegistry(BookingProviderAdapter fallback) {
        if (fallback == null) {
            throw new IllegalArgumentException("A fallback provider adapter is required");
        }
        this.fallback = fallback;
        register(fallback.providerId(), fallback);
    }

    // Last registration for an id wins
    public synchronized void register(String providerId, BookingProviderAdapter adapter) {
        BookingProviderAdapter previous = adapters.put(providerId, adapter);
        if (previous != null && previous != adapter) {
            log.info("Provider {} re-registered, replacing {}", providerId, previous.getClass().getSimpleName());
        } else {
            log.info("Registered provider {}", providerId);
        }
    }

    /**
     * Removes an adapter. The fallback stays registered.
     */
    public synchronized void unregister(String providerId) {
        if (fallback.providerId().equals(providerId)) {
            log.warn("Refusing to unregister fallback provider {}", providerId);
            return;
        }
        if (adapters.remove(providerId) != null) {
            log.info("Unregistered provider {}", providerId);
        }
    }

    public synchronized BookingProviderAdapter resolve(Hotel hotel) {
        if (hotel.getProviderId() != null) {
            BookingProviderAdapter explicit = adapters.get(hotel.getProviderId());
            if (explicit != null) {
                return explicit;
            }
        }
        for (BookingProviderAdapter adapter : adapters.values()) {
            if (supports(adapter, hotel)) {
                return adapter;
            }
        }
        log.warn("No provider found for hotel {} (providerId={}), using fallback {}",
                hotel.getId(), hotel.getProviderId(), fallback.providerId());
        return fallback;
    }

    public synchronized Optional<BookingProviderAdapter> getProvider(String providerId) {
        return Optional.ofNullable(adapters.get(providerId));
    }

    public synchronized List<BookingProviderAdapter> getAllProviders() {
        return new ArrayList<>(adapters.values());
    }

    public BookingProviderAdapter getFallback() {
        return fallback;
    }

    private boolean supports(BookingProviderAdapter adapter, Hotel hotel) {
        try {
            return adapter.supportsHotel(hotel);
        } catch (RuntimeException e) {
            log.warn("Provider {} failed capability check for hotel {}: {}",
                    adapter.providerId(), hotel.getId(), e.getMessage());
            return false;
        }
    }
}
