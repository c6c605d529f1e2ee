package com.hotel.booking.model.entity;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A reservation as confirmed by a provider.
 *
 * Created by a successful provider reservation call. A modification produces
 * a new version (toBuilder copy) rather than editing the stored one, so an
 * aborted modification never leaves a half-updated booking behind.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BookingConfirmation {
    private String bookingId;
    private String referenceNumber;
    private Hotel hotel;
    private LocalDate checkInDate;
    private LocalDate checkOutDate;
    private GuestInfo guestInfo;
    private RoomOption roomDetails;
    private PricingDetails pricing;
    private BookingStatus status;

    /**
     * Payment captured for this booking, used for refunds on modification or
     * cancellation.
     */
    private String paymentIntentId;

    // Caller identity that created the booking
    private String ownerId;

    private Instant confirmationSentAt;
    private Instant createdAt;
    private Instant updatedAt;

    public boolean isCancelled() {
        return status != null && status.isTerminal();
    }
}
