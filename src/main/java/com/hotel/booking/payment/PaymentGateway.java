package com.hotel.booking.payment;

import io.vertx.core.Future;

import java.util.Map;

/**
 * Payment collaborator used by the modification and cancellation flows.
 * Amounts are minor units.
 */
public interface PaymentGateway {

    Future<PaymentIntent> createPaymentIntent(long amount, String currency, Map<String, String> metadata);

    /**
     * Completes with status FAILED for a declined payment; a failed Future means
     * the gateway itself could not be reached.
     */
    Future<PaymentConfirmation> confirmPayment(String paymentIntentId, String paymentMethodId);

    Future<RefundConfirmation> processRefund(String paymentIntentId, long amount, String reason);
}
