package com.hotel.booking.cache;

import java.time.LocalDate;

/**
 * Deterministic cache keys. Dates render as ISO-8601 (yyyy-MM-dd).
 */
public final class CacheKeys {

    private CacheKeys() {
    }

    public static String availability(long hotelId, LocalDate checkIn, LocalDate checkOut) {
        return CacheNamespace.AVAILABILITY.hotelPrefix(hotelId) + checkIn + ":" + checkOut;
    }

    public static String pricing(long hotelId, String roomId, LocalDate checkIn, LocalDate checkOut) {
        return CacheNamespace.PRICING.hotelPrefix(hotelId) + roomId + ":" + checkIn + ":" + checkOut;
    }
}
