package com.hotel.booking.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Display-currency overlay on a quote. The source amounts are never rewritten.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConvertedTotal {
    private BigDecimal amount;
    private String currency;
    private BigDecimal rate;
}
