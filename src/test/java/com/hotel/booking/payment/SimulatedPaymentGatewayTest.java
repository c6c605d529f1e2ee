package com.hotel.booking.payment;

import com.hotel.booking.exception.PaymentException;
import com.hotel.booking.model.entity.RefundStatus;
import io.vertx.core.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TestCategory: Unit Test - Simulated payment processor
 */
class SimulatedPaymentGatewayTest {

    private SimulatedPaymentGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new SimulatedPaymentGateway();
    }

    /**
     * Input: 25000 minor units in "USD", then confirm with a valid method
     * ExpectedOut: intent in lowercase currency awaiting confirmation, then
     * SUCCEEDED
     */
    @Test
    void testCreateAndConfirm_Succeeds() {
        // Given
        PaymentIntent intent = gateway.createPaymentIntent(25000, "USD",
                Map.of("bookingId", "BK1000", "type", "modification")).result();

        // When
        PaymentConfirmation confirmation = gateway.confirmPayment(intent.getId(), "pm_card_visa").result();

        // Then
        assertTrue(intent.getId().startsWith("pi_"));
        assertEquals("usd", intent.getCurrency());
        assertEquals(PaymentStatus.REQUIRES_CONFIRMATION, intent.getStatus());
        assertEquals("BK1000", intent.getMetadata().get("bookingId"));
        assertTrue(confirmation.isSucceeded());
    }

    @Test
    void testConfirm_DeclinedMethod() {
        PaymentIntent intent = gateway.createPaymentIntent(100, "usd", null).result();

        PaymentConfirmation confirmation = gateway.confirmPayment(intent.getId(), "pm_card_declined").result();

        assertFalse(confirmation.isSucceeded());
        assertEquals(PaymentStatus.FAILED, confirmation.getStatus());
        assertNotNull(confirmation.getFailureMessage());
    }

    @Test
    void testConfirm_UnknownIntent() {
        Future<PaymentConfirmation> result = gateway.confirmPayment("pi_missing", "pm_card_visa");

        assertTrue(result.failed());
        assertInstanceOf(PaymentException.class, result.cause());
    }

    @Test
    void testAmountsMustBePositive() {
        assertInstanceOf(PaymentException.class, gateway.createPaymentIntent(0, "usd", Map.of()).cause());
        assertInstanceOf(PaymentException.class, gateway.processRefund("pi_1", -5, "test").cause());
    }

    @Test
    void testProcessRefund_Succeeds() {
        RefundConfirmation refund = gateway.processRefund("pi_123", 5000, "Booking cancelled by customer").result();

        assertTrue(refund.getRefundId().startsWith("re_"));
        assertEquals(5000, refund.getAmount());
        assertEquals(RefundStatus.SUCCEEDED, refund.getStatus());
        assertEquals("pi_123", refund.getPaymentIntentId());
    }
}
