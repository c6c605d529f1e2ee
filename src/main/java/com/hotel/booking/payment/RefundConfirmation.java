package com.hotel.booking.payment;

import com.hotel.booking.model.entity.RefundStatus;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RefundConfirmation {
    String refundId;
    String paymentIntentId;
    long amount;
    RefundStatus status;
    String reason;
}
