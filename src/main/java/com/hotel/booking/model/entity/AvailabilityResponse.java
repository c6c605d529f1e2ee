package com.hotel.booking.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Availability for one hotel and stay.
 *
 * cachedAt / expiresAt mirror the cache entry metadata so clients can tell
 * how fresh the inventory is. Two responses served from the same cache
 * entry carry the same cachedAt.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AvailabilityResponse {
    private long hotelId;
    private LocalDate checkInDate;
    private LocalDate checkOutDate;
    private boolean available;
    private List<RoomOption> rooms;
    private Instant cachedAt;
    private Instant expiresAt;

    public Optional<RoomOption> findRoom(String roomId) {
        if (rooms == null || roomId == null) {
            return Optional.empty();
        }
        return rooms.stream()
                .filter(room -> roomId.equals(room.getId()))
                .findFirst();
    }
}
