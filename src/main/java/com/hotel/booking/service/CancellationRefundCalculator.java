package com.hotel.booking.service;

import com.hotel.booking.config.BookingProperties;
import com.hotel.booking.model.entity.BookingConfirmation;
import com.hotel.booking.model.entity.CancellationPolicy;
import com.hotel.booking.model.entity.CancellationRule;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Applies a hotel's cancellation policy.
 *
 * RULE SELECTION:
 * - Rules sorted by daysBeforeCheckIn, largest first
 * - First rule whose threshold is met by the days left until check-in wins
 * - Nothing met (check-in already passed): the zero-day rule, else no refund
 *
 * AMOUNT: max(0, total x percentage / 100 - fee)
 */
@Service
public class CancellationRefundCalculator {

    private final Clock clock;
    private final ZoneId zone;

    @Autowired
    public CancellationRefundCalculator(Clock clock, BookingProperties properties) {
        this.clock = clock;
        this.zone = ZoneId.of(properties.getZone());
    }

    public long daysUntilCheckIn(LocalDate checkIn) {
        return ChronoUnit.DAYS.between(LocalDate.now(clock.withZone(zone)), checkIn);
    }

    public Optional<CancellationRule> selectRule(CancellationPolicy policy, long daysUntilCheckIn) {
        if (policy == null || policy.getRules() == null || policy.getRules().isEmpty()) {
            return Optional.empty();
        }
        List<CancellationRule> sorted = policy.getRules().stream()
                .sorted(Comparator.comparingInt(CancellationRule::getDaysBeforeCheckIn).reversed())
                .collect(Collectors.toList());
        Optional<CancellationRule> matched = sorted.stream()
                .filter(rule -> daysUntilCheckIn >= rule.getDaysBeforeCheckIn())
                .findFirst();
        if (matched.isPresent()) {
            return matched;
        }
        return sorted.stream().filter(rule -> rule.getDaysBeforeCheckIn() == 0).findFirst();
    }

    public RefundQuote calculate(BookingConfirmation booking) {
        long days = daysUntilCheckIn(booking.getCheckInDate());
        CancellationPolicy policy = booking.getHotel() == null ? null : booking.getHotel().getCancellationPolicy();
        Optional<CancellationRule> rule = selectRule(policy, days);
        if (rule.isEmpty()) {
            return new RefundQuote(0, PricingCalculator.money(BigDecimal.ZERO), days);
        }
        return new RefundQuote(rule.get().getRefundPercentage(),
                refundAmount(booking.getPricing().getTotal(), rule.get()), days);
    }

    public BigDecimal refundAmount(BigDecimal total, CancellationRule rule) {
        BigDecimal gross = total.multiply(BigDecimal.valueOf(rule.getRefundPercentage()))
                .divide(BigDecimal.valueOf(100));
        BigDecimal fee = rule.getFee() == null ? BigDecimal.ZERO : rule.getFee();
        BigDecimal net = gross.subtract(fee);
        return PricingCalculator.money(net.signum() < 0 ? BigDecimal.ZERO : net);
    }
}
