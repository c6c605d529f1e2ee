package com.hotel.booking.payment;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Amount to collect, in minor units (cents) of a lowercase ISO currency.
 */
@Value
@Builder
public class PaymentIntent {
    String id;
    long amount;
    String currency;
    PaymentStatus status;
    Map<String, String> metadata;
}
