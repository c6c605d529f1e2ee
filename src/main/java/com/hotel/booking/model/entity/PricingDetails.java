package com.hotel.booking.model.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Price quote for one room and stay.
 *
 * Invariant: total == subtotal + sum(taxes) + sum(fees), all in {@code currency}.
 * {@code convertedTotal} is a display overlay only.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PricingDetails {
    private BigDecimal baseRate;
    private int numberOfNights;
    private BigDecimal subtotal;
    private List<TaxLine> taxes;
    private List<FeeLine> fees;
    private BigDecimal total;
    private String currency;

    /**
     * -@JsonInclude(NON_NULL): Only serialized when a display currency was
     * requested.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private ConvertedTotal convertedTotal;

    /**
     * Currency the quote is shown in: the converted currency when an overlay
     * exists, otherwise the source currency.
     */
    @JsonIgnore
    public String getDisplayCurrency() {
        return convertedTotal != null ? convertedTotal.getCurrency() : currency;
    }
}
