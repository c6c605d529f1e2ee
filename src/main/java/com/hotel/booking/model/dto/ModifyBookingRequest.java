package com.hotel.booking.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Modification payload: the changes plus the payment references needed to
 * settle a price difference.
 * - paymentMethodId: charged when the new stay costs more
 * - paymentIntentId: refunded when it costs less (defaults to the booking's
 * own payment intent)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModifyBookingRequest {
    private BookingChanges changes;
    private String paymentMethodId;
    private String paymentIntentId;
}
