package com.hotel.booking.model.entity;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * -@Data: Lombok annotation for automatic boilerplate code generation.
 * --Generates getters/setters, equals(), hashCode() and toString()
 * =========
 * -@Builder(toBuilder = true): Generates a fluent builder
 * --toBuilder() copies an existing hotel snapshot before changing it
 * --WithoutIT: Bookings would share one mutable Hotel instance;
 * ---a later edit would leak into every stored snapshot.
 * =========
 * -@NoArgsConstructor / @AllArgsConstructor: Required by Jackson and by the
 * builder respectively.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Hotel {
    private long id;
    private String title;
    private String location;

    /**
     * Provider binding. When null, the ProviderRegistry falls back to a
     * capability scan and finally to the designated fallback adapter.
     */
    private String providerId;
    private String providerHotelId;

    private boolean instantBooking;
    private String checkInTime;
    private String checkOutTime;
    private CancellationPolicy cancellationPolicy;
}
