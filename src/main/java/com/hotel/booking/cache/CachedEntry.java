package com.hotel.booking.cache;

import lombok.Value;

import java.time.Instant;

/**
 * -@Value: Lombok immutable value class (final fields, getters, equals,
 * hashCode, toString).
 * --A cache write replaces the whole entry, entries are never mutated
 */
@Value
public class CachedEntry<T> {
    T data;
    Instant cachedAt;
    Instant expiresAt;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
