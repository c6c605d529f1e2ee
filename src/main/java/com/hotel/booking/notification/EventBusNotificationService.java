package com.hotel.booking.notification;

import com.hotel.booking.exception.NotificationException;
import com.hotel.booking.model.entity.BookingConfirmation;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * -@Service: Default notification channel.
 * --Publishes one event per notification on the Vert.x event bus; mail
 * delivery subscribes to those addresses
 * --WithoutIT: BookingOrchestrator has no NotificationService to inject.
 * =========
 * EVENT PAYLOAD:
 * - bookingId, referenceNumber, email, status, timestamp
 * - refundAmount / refundCurrency on cancellation
 */
@Service
@Slf4j
public class EventBusNotificationService implements NotificationService {

    private final Vertx vertx;
    private final Clock clock;

    @Autowired
    public EventBusNotificationService(Vertx vertx, Clock clock) {
        this.vertx = vertx;
        this.clock = clock;
    }

    @Override
    public Future<Void> sendBookingConfirmation(BookingConfirmation booking, String email) {
        return publish(BookingEvents.CONFIRMED, booking, email, null);
    }

    @Override
    public Future<Void> sendModificationConfirmation(BookingConfirmation booking, String email) {
        return publish(BookingEvents.MODIFIED, booking, email, null);
    }

    @Override
    public Future<Void> sendCancellationConfirmation(BookingConfirmation booking, BigDecimal refundAmount,
            String email) {
        return publish(BookingEvents.CANCELLED, booking, email, refundAmount);
    }

    private Future<Void> publish(String address, BookingConfirmation booking, String email, BigDecimal refund) {
        if (email == null || email.isBlank()) {
            return Future.failedFuture(new NotificationException(
                    "No recipient for " + address + " of booking " + booking.getBookingId(), null));
        }
        JsonObject event = new JsonObject()
                .put("bookingId", booking.getBookingId())
                .put("referenceNumber", booking.getReferenceNumber())
                .put("email", email)
                .put("status", booking.getStatus() == null ? null : booking.getStatus().getValue())
                .put("timestamp", clock.instant().toString());
        if (refund != null) {
            event.put("refundAmount", refund.toPlainString());
            event.put("refundCurrency", booking.getPricing() == null ? null : booking.getPricing().getCurrency());
        }
        try {
            vertx.eventBus().publish(address, event);
        } catch (RuntimeException e) {
            return Future.failedFuture(new NotificationException("Failed to publish " + address, e));
        }
        log.debug("Published {} for booking {}", address, booking.getBookingId());
        return Future.succeededFuture();
    }
}
