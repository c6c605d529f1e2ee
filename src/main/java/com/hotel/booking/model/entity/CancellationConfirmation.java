package com.hotel.booking.model.entity;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CancellationConfirmation {
    private String bookingId;
    private String referenceNumber;
    private Instant cancelledAt;
    private int refundPercentage;
    private BigDecimal refundAmount;
    private String refundCurrency;
    private RefundStatus refundStatus;
    private String reason;
}
