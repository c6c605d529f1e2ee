package com.hotel.booking.payment;

import com.hotel.booking.exception.PaymentException;
import com.hotel.booking.model.entity.RefundStatus;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process payment gateway.
 *
 * - Payment method ids containing "declined" are declined
 * - Refunds succeed for any positive amount
 */
@Component
@Slf4j
public class SimulatedPaymentGateway implements PaymentGateway {

    private final Map<String, PaymentIntent> intents = new ConcurrentHashMap<>();

    @Override
    public Future<PaymentIntent> createPaymentIntent(long amount, String currency, Map<String, String> metadata) {
        if (amount <= 0) {
            return Future.failedFuture(new PaymentException("Payment amount must be positive: " + amount));
        }
        PaymentIntent intent = PaymentIntent.builder()
                .id("pi_" + shortId())
                .amount(amount)
                .currency(currency.toLowerCase(Locale.ROOT))
                .status(PaymentStatus.REQUIRES_CONFIRMATION)
                .metadata(metadata == null ? Map.of() : Map.copyOf(metadata))
                .build();
        intents.put(intent.getId(), intent);
        log.info("Created payment intent {} for {} {}", intent.getId(), amount, intent.getCurrency());
        return Future.succeededFuture(intent);
    }

    @Override
    public Future<PaymentConfirmation> confirmPayment(String paymentIntentId, String paymentMethodId) {
        PaymentIntent intent = intents.get(paymentIntentId);
        if (intent == null) {
            return Future.failedFuture(new PaymentException("Unknown payment intent: " + paymentIntentId));
        }
        if (paymentMethodId == null || paymentMethodId.isBlank() || paymentMethodId.contains("declined")) {
            log.warn("Payment {} declined for method {}", paymentIntentId, paymentMethodId);
            return Future.succeededFuture(PaymentConfirmation.builder()
                    .paymentIntentId(paymentIntentId)
                    .status(PaymentStatus.FAILED)
                    .failureMessage("Your card was declined")
                    .build());
        }
        intents.put(paymentIntentId, PaymentIntent.builder()
                .id(intent.getId())
                .amount(intent.getAmount())
                .currency(intent.getCurrency())
                .metadata(intent.getMetadata())
                .status(PaymentStatus.SUCCEEDED)
                .build());
        log.info("Payment {} confirmed", paymentIntentId);
        return Future.succeededFuture(PaymentConfirmation.builder()
                .paymentIntentId(paymentIntentId)
                .status(PaymentStatus.SUCCEEDED)
                .build());
    }

    @Override
    public Future<RefundConfirmation> processRefund(String paymentIntentId, long amount, String reason) {
        if (amount <= 0) {
            return Future.failedFuture(new PaymentException("Refund amount must be positive: " + amount));
        }
        RefundConfirmation refund = RefundConfirmation.builder()
                .refundId("re_" + shortId())
                .paymentIntentId(paymentIntentId)
                .amount(amount)
                .status(RefundStatus.SUCCEEDED)
                .reason(reason)
                .build();
        log.info("Refunded {} on {} ({})", amount, paymentIntentId, reason);
        return Future.succeededFuture(refund);
    }

    private static String shortId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
