package com.hotel.booking.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CancellationPolicy {

    /**
     * flexible | moderate | strict | non-refundable
     */
    private String type;
    private String description;

    @Builder.Default
    private List<CancellationRule> rules = new ArrayList<>();

    public static CancellationPolicy flexible() {
        return new CancellationPolicy("flexible", "Free cancellation up to 24 hours before check-in",
                new ArrayList<>(List.of(CancellationRule.of(1, 100), CancellationRule.of(0, 0))));
    }

    public static CancellationPolicy moderate() {
        return new CancellationPolicy("moderate", "Free cancellation up to 5 days before check-in",
                new ArrayList<>(List.of(CancellationRule.of(5, 100), CancellationRule.of(2, 50),
                        CancellationRule.of(0, 0))));
    }

    public static CancellationPolicy strict() {
        return new CancellationPolicy("strict", "Free cancellation up to 14 days before check-in",
                new ArrayList<>(List.of(CancellationRule.of(14, 100), CancellationRule.of(7, 50),
                        CancellationRule.of(0, 0))));
    }

    public static CancellationPolicy nonRefundable() {
        return new CancellationPolicy("non-refundable", "Non-refundable booking",
                new ArrayList<>(List.of(CancellationRule.of(0, 0))));
    }
}
