package com.hotel.booking.service;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Refund owed on cancellation: the matched rule's percentage and the amount in
 * the booking currency.
 */
@Value
public class RefundQuote {
    int refundPercentage;
    BigDecimal amount;
    long daysUntilCheckIn;

    public boolean isOwed() {
        return amount.signum() > 0;
    }
}
