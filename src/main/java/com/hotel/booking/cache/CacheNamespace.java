package com.hotel.booking.cache;

import java.util.Arrays;
import java.util.Optional;

/**
 * The two cache namespaces. Each maps onto a Spring cache of the same name.
 */
public enum CacheNamespace {
    AVAILABILITY("availability"),
    PRICING("pricing");

    private final String cacheName;

    CacheNamespace(String cacheName) {
        this.cacheName = cacheName;
    }

    public String getCacheName() {
        return cacheName;
    }

    /**
     * Prefix shared by every key of one hotel in this namespace. The trailing
     * colon keeps hotel 1 from matching hotel 12.
     */
    public String hotelPrefix(long hotelId) {
        return cacheName + ":" + hotelId + ":";
    }

    public static Optional<CacheNamespace> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(ns -> key.startsWith(ns.cacheName + ":"))
                .findFirst();
    }
}
