package com.hotel.booking.model.dto;

import com.hotel.booking.model.entity.GuestInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Partial update of an existing reservation. Null fields keep their current
 * value.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BookingChanges {
    private LocalDate checkInDate;
    private LocalDate checkOutDate;
    private String roomId;
    private GuestInfo guestInfo;

    public boolean isEmpty() {
        return checkInDate == null && checkOutDate == null && roomId == null && guestInfo == null;
    }
}
