package com.hotel.booking.cache;

import com.hotel.booking.config.BookingProperties;
import com.hotel.booking.model.entity.AvailabilityResponse;
import com.hotel.booking.model.entity.PricingDetails;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentMap;

/**
 * TTL-stamped store for availability responses and pricing quotes.
 *
 * -@Component: Spring-managed singleton shared by the orchestrator and the
 * periodic cleanup.
 * --WithoutIT: BookingOrchestrator and CacheMaintenance could not be wired.
 * =========
 * STORAGE:
 * - One Spring cache per namespace ("availability", "pricing") obtained from
 * the CacheManager
 * - Values are CachedEntry wrappers; expiry is checked on every read (lazy
 * eviction) and by cleanExpired()
 * - Prefix invalidation walks the cache's native ConcurrentMap, so the
 * CacheManager must hand out map-backed caches
 */
@Component
@Slf4j
public class CacheStore {

    private final CacheManager cacheManager;
    private final Clock clock;
    private final Duration availabilityTtl;
    private final Duration pricingTtl;

    @Autowired
    public CacheStore(CacheManager cacheManager, Clock clock, BookingProperties properties) {
        this.cacheManager = cacheManager;
        this.clock = clock;
        this.availabilityTtl = properties.getCache().getAvailabilityTtl();
        this.pricingTtl = properties.getCache().getPricingTtl();
    }

    /**
     * Stores data under key with expiresAt = now + ttl. Last write wins.
     *
     * @throws IllegalArgumentException for a key outside both namespaces or a
     *                                  non-positive ttl
     */
    public <T> CachedEntry<T> set(String key, T data, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must be positive: " + ttl);
        }
        return put(key, data, clock.instant(), ttl);
    }

    /**
     * Returns the stored value while now < expiresAt; an expired entry is
     * evicted and reported as absent.
     */
    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(String key) {
        Optional<CacheNamespace> namespace = CacheNamespace.fromKey(key);
        if (namespace.isEmpty()) {
            return Optional.empty();
        }
        Cache cache = cache(namespace.get());
        Cache.ValueWrapper wrapper = cache.get(key);
        if (wrapper == null || wrapper.get() == null) {
            return Optional.empty();
        }
        CachedEntry<T> entry = (CachedEntry<T>) wrapper.get();
        if (entry.isExpired(clock.instant())) {
            cache.evict(key);
            log.debug("Evicted expired entry {}", key);
            return Optional.empty();
        }
        return Optional.ofNullable(entry.getData());
    }

    public Optional<AvailabilityResponse> getAvailability(long hotelId, LocalDate checkIn, LocalDate checkOut) {
        return get(CacheKeys.availability(hotelId, checkIn, checkOut));
    }

    /**
     * Stores the response stamped with the entry's cachedAt/expiresAt, so every
     * hit returns the same markers.
     */
    public CachedEntry<AvailabilityResponse> setAvailability(long hotelId, LocalDate checkIn, LocalDate checkOut,
            AvailabilityResponse data) {
        Instant now = clock.instant();
        AvailabilityResponse stamped = data.toBuilder()
                .cachedAt(now)
                .expiresAt(now.plus(availabilityTtl))
                .build();
        return put(CacheKeys.availability(hotelId, checkIn, checkOut), stamped, now, availabilityTtl);
    }

    public Optional<PricingDetails> getPricing(long hotelId, String roomId, LocalDate checkIn, LocalDate checkOut) {
        return get(CacheKeys.pricing(hotelId, roomId, checkIn, checkOut));
    }

    public CachedEntry<PricingDetails> setPricing(long hotelId, String roomId, LocalDate checkIn,
            LocalDate checkOut, PricingDetails data) {
        return set(CacheKeys.pricing(hotelId, roomId, checkIn, checkOut), data, pricingTtl);
    }

    // Idempotent: removing an absent key is a no-op
    public void invalidate(String key) {
        CacheNamespace.fromKey(key).ifPresent(ns -> cache(ns).evict(key));
    }

    /**
     * Removes every entry of the namespace belonging to one hotel.
     *
     * @return number of entries removed
     */
    public int invalidateByPrefix(CacheNamespace namespace, long hotelId) {
        String prefix = namespace.hotelPrefix(hotelId);
        ConcurrentMap<Object, Object> store = nativeStore(namespace);
        int removed = 0;
        for (Object key : store.keySet()) {
            if (key instanceof String && ((String) key).startsWith(prefix) && store.remove(key) != null) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Invalidated {} {} entries for hotel {}", removed, namespace.getCacheName(), hotelId);
        }
        return removed;
    }

    public int invalidateHotel(long hotelId) {
        int removed = invalidateByPrefix(CacheNamespace.AVAILABILITY, hotelId)
                + invalidateByPrefix(CacheNamespace.PRICING, hotelId);
        log.info("Invalidated {} cache entries for hotel {}", removed, hotelId);
        return removed;
    }

    public void invalidateNamespace(CacheNamespace namespace) {
        cache(namespace).clear();
        log.info("Cleared {} cache", namespace.getCacheName());
    }

    public void invalidateAll() {
        for (CacheNamespace namespace : CacheNamespace.values()) {
            invalidateNamespace(namespace);
        }
    }

    /**
     * Sweeps both namespaces, removing entries whose expiresAt <= now.
     *
     * @return number of entries removed
     */
    public int cleanExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (CacheNamespace namespace : CacheNamespace.values()) {
            ConcurrentMap<Object, Object> store = nativeStore(namespace);
            for (Map.Entry<Object, Object> e : store.entrySet()) {
                if (isExpired(e.getValue(), now) && store.remove(e.getKey(), e.getValue())) {
                    removed++;
                }
            }
        }
        return removed;
    }

    public CacheStats stats() {
        Instant now = clock.instant();
        int[] availability = count(CacheNamespace.AVAILABILITY, now);
        int[] pricing = count(CacheNamespace.PRICING, now);
        return new CacheStats(availability[0], availability[1], pricing[0], pricing[1]);
    }

    private int[] count(CacheNamespace namespace, Instant now) {
        int total = 0;
        int expired = 0;
        for (Object value : nativeStore(namespace).values()) {
            total++;
            if (isExpired(value, now)) {
                expired++;
            }
        }
        return new int[] { total, expired };
    }

    private static boolean isExpired(Object value, Instant now) {
        return value instanceof CachedEntry && ((CachedEntry<?>) value).isExpired(now);
    }

    private <T> CachedEntry<T> put(String key, T data, Instant now, Duration ttl) {
        CacheNamespace namespace = namespaceOf(key);
        CachedEntry<T> entry = new CachedEntry<>(data, now, now.plus(ttl));
        cache(namespace).put(key, entry);
        log.debug("Cached {} until {}", key, entry.getExpiresAt());
        return entry;
    }

    private CacheNamespace namespaceOf(String key) {
        return CacheNamespace.fromKey(key)
                .orElseThrow(() -> new IllegalArgumentException("Unknown cache namespace for key: " + key));
    }

    private Cache cache(CacheNamespace namespace) {
        Cache cache = cacheManager.getCache(namespace.getCacheName());
        if (cache == null) {
            throw new IllegalStateException("Cache not configured: " + namespace.getCacheName());
        }
        return cache;
    }

    @SuppressWarnings("unchecked")
    private ConcurrentMap<Object, Object> nativeStore(CacheNamespace namespace) {
        Object nativeCache = cache(namespace).getNativeCache();
        if (!(nativeCache instanceof ConcurrentMap)) {
            throw new IllegalStateException("Cache " + namespace.getCacheName() + " is not map-backed");
        }
        return (ConcurrentMap<Object, Object>) nativeCache;
    }
}
