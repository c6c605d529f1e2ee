package com.hotel.booking.service;

import com.hotel.booking.config.BookingProperties;
import com.hotel.booking.model.entity.PricingDetails;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TestCategory: Unit Test - Price breakdown and currency overlay
 */
class PricingCalculatorTest {

    private PricingCalculator calculator;

    @BeforeEach
    void setUp() {
        BookingProperties properties = new BookingProperties();
        properties.getPricing().setExchangeRates(Map.of("EUR", new BigDecimal("0.92")));
        calculator = new PricingCalculator(properties);
    }

    /**
     * Input: 180/night, 3 nights
     * ExpectedOut: subtotal 540.00, tax 12% = 64.80, fee 25.00, total 629.80 USD
     */
    @Test
    void testCalculate_Breakdown() {
        // When
        PricingDetails pricing = calculator.calculate(new BigDecimal("180"),
                LocalDate.of(2030, 5, 1), LocalDate.of(2030, 5, 4));

        // Then
        assertEquals(3, pricing.getNumberOfNights());
        assertEquals(new BigDecimal("180.00"), pricing.getBaseRate());
        assertEquals(new BigDecimal("540.00"), pricing.getSubtotal());
        assertEquals(new BigDecimal("64.80"), pricing.getTaxes().get(0).getAmount());
        assertEquals(0, new BigDecimal("12").compareTo(pricing.getTaxes().get(0).getPercentage()));
        assertEquals("Hotel Tax", pricing.getTaxes().get(0).getName());
        assertEquals(new BigDecimal("25.00"), pricing.getFees().get(0).getAmount());
        assertEquals(new BigDecimal("629.80"), pricing.getTotal());
        assertEquals("USD", pricing.getCurrency());
        assertNull(pricing.getConvertedTotal());
    }

    /**
     * Input: 629.80 USD converted to eur
     * ExpectedOut: overlay 579.42 EUR at 0.92, source amounts untouched
     */
    @Test
    void testConvert_AddsOverlay() {
        PricingDetails pricing = calculator.calculate(new BigDecimal("180"),
                LocalDate.of(2030, 5, 1), LocalDate.of(2030, 5, 4));

        PricingDetails converted = calculator.convert(pricing, "eur");

        assertEquals("EUR", converted.getConvertedTotal().getCurrency());
        assertEquals(new BigDecimal("579.42"), converted.getConvertedTotal().getAmount());
        assertEquals(new BigDecimal("0.92"), converted.getConvertedTotal().getRate());
        assertEquals(new BigDecimal("629.80"), converted.getTotal());
        assertEquals("USD", converted.getCurrency());
        assertEquals("EUR", converted.getDisplayCurrency());
        assertNull(pricing.getConvertedTotal(), "input pricing is not mutated");
    }

    @Test
    void testConvert_UnknownCurrencyUsesRateOne() {
        PricingDetails pricing = calculator.calculate(new BigDecimal("100"),
                LocalDate.of(2030, 5, 1), LocalDate.of(2030, 5, 2));

        PricingDetails converted = calculator.convert(pricing, "CHF");

        assertEquals(BigDecimal.ONE, converted.getConvertedTotal().getRate());
        assertEquals(pricing.getTotal(), converted.getConvertedTotal().getAmount());
    }

    @Test
    void testConvert_SourceOrMissingCurrencyLeavesPricing() {
        PricingDetails pricing = calculator.calculate(new BigDecimal("100"),
                LocalDate.of(2030, 5, 1), LocalDate.of(2030, 5, 2));
        PricingDetails inEur = calculator.convert(pricing, "EUR");

        assertSame(pricing, calculator.convert(pricing, null));
        assertNull(calculator.convert(inEur, "usd").getConvertedTotal());
        assertEquals("USD", calculator.convert(inEur, "USD").getDisplayCurrency());
    }

    @Test
    void testToMinorUnits() {
        assertEquals(62980L, PricingCalculator.toMinorUnits(new BigDecimal("629.80")));
        assertEquals(1L, PricingCalculator.toMinorUnits(new BigDecimal("0.005")));
    }
}
