package com.hotel.booking.cache;

import lombok.Value;

/**
 * Snapshot of entry counts per namespace, expired entries included until they
 * are swept.
 */
@Value
public class CacheStats {
    int availabilityEntries;
    int availabilityExpired;
    int pricingEntries;
    int pricingExpired;

    public int getTotalEntries() {
        return availabilityEntries + pricingEntries;
    }
}
