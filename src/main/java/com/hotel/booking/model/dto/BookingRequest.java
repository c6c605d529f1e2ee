package com.hotel.booking.model.dto;

import com.hotel.booking.model.entity.GuestInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Request payload for a new reservation.
 *
 * The naming follows the rest of the codebase: Request/Response suffixes for
 * objects crossing the REST boundary.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BookingRequest {
    private Long hotelId;
    private String roomId;
    private LocalDate checkInDate;
    private LocalDate checkOutDate;
    private GuestInfo guestInfo;
    // confirmed payment reference, kept on the booking for later refunds
    private String paymentMethodId;
    private String specialRequests;

    // set when the guest is authenticated
    private String userId;
}
