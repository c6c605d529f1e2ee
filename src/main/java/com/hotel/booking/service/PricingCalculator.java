package com.hotel.booking.service;

import com.hotel.booking.config.BookingProperties;
import com.hotel.booking.model.entity.ConvertedTotal;
import com.hotel.booking.model.entity.FeeLine;
import com.hotel.booking.model.entity.PricingDetails;
import com.hotel.booking.model.entity.TaxLine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * -@Service: Stateless price computation shared by the orchestrator and the
 * in-memory provider.
 * =========
 * PRICING:
 * - nights = calendar days between check-in and check-out
 * - subtotal = nightly rate x nights
 * - one percentage tax line on the subtotal, one flat service fee line
 * - total = subtotal + taxes + fees, all in the source currency
 * - currency conversion only adds a convertedTotal overlay; the source amounts
 * are never touched
 * - money carries 2 decimals, HALF_UP
 */
@Service
@Slf4j
public class PricingCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BookingProperties.Pricing config;

    @Autowired
    public PricingCalculator(BookingProperties properties) {
        this.config = properties.getPricing();
    }

    public PricingDetails calculate(BigDecimal nightlyRate, LocalDate checkIn, LocalDate checkOut) {
        int nights = nights(checkIn, checkOut);
        BigDecimal baseRate = money(nightlyRate);
        BigDecimal subtotal = money(baseRate.multiply(BigDecimal.valueOf(nights)));
        BigDecimal taxAmount = money(subtotal.multiply(config.getTaxRate()));
        BigDecimal serviceFee = money(config.getServiceFee());

        TaxLine tax = TaxLine.builder()
                .name(config.getTaxName())
                .amount(taxAmount)
                .percentage(config.getTaxRate().movePointRight(2))
                .build();
        FeeLine fee = FeeLine.builder()
                .name(config.getServiceFeeName())
                .amount(serviceFee)
                .description(config.getServiceFeeDescription())
                .build();

        return PricingDetails.builder()
                .baseRate(baseRate)
                .numberOfNights(nights)
                .subtotal(subtotal)
                .taxes(List.of(tax))
                .fees(List.of(fee))
                .total(subtotal.add(taxAmount).add(serviceFee))
                .currency(config.getCurrency())
                .build();
    }

    /**
     * Adds a converted total for display. Unknown currencies convert at rate 1;
     * no target, or the source currency, returns the pricing unchanged.
     */
    public PricingDetails convert(PricingDetails pricing, String targetCurrency) {
        if (targetCurrency == null || targetCurrency.isBlank()) {
            return pricing;
        }
        String target = targetCurrency.toUpperCase(Locale.ROOT);
        if (target.equalsIgnoreCase(pricing.getCurrency())) {
            return pricing.toBuilder().convertedTotal(null).build();
        }
        BigDecimal rate = exchangeRate(target);
        ConvertedTotal converted = ConvertedTotal.builder()
                .amount(money(pricing.getTotal().multiply(rate)))
                .currency(target)
                .rate(rate)
                .build();
        return pricing.toBuilder().convertedTotal(converted).build();
    }

    public int nights(LocalDate checkIn, LocalDate checkOut) {
        return (int) ChronoUnit.DAYS.between(checkIn, checkOut);
    }

    public String getSourceCurrency() {
        return config.getCurrency();
    }

    public static BigDecimal money(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }

    public static long toMinorUnits(BigDecimal amount) {
        return amount.multiply(HUNDRED).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    private BigDecimal exchangeRate(String currency) {
        Map<String, BigDecimal> rates = config.getExchangeRates();
        BigDecimal rate = rates == null ? null
                : rates.entrySet().stream()
                        .filter(entry -> entry.getKey().equalsIgnoreCase(currency))
                        .map(Map.Entry::getValue)
                        .findFirst()
                        .orElse(null);
        if (rate == null) {
            log.warn("No exchange rate configured for {}, using 1", currency);
            return BigDecimal.ONE;
        }
        return rate;
    }
}
