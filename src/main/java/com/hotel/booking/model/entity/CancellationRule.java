package com.hotel.booking.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * A refund threshold: cancelling at least {@code daysBeforeCheckIn} days ahead
 * refunds {@code refundPercentage} of the total, minus an optional flat fee.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CancellationRule {
    private int daysBeforeCheckIn;
    private int refundPercentage;
    private BigDecimal fee;

    public static CancellationRule of(int daysBeforeCheckIn, int refundPercentage) {
        return new CancellationRule(daysBeforeCheckIn, refundPercentage, null);
    }
}
