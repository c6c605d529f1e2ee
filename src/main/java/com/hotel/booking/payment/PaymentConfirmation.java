package com.hotel.booking.payment;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PaymentConfirmation {
    String paymentIntentId;
    PaymentStatus status;
    String failureMessage;

    public boolean isSucceeded() {
        return status == PaymentStatus.SUCCEEDED;
    }
}
