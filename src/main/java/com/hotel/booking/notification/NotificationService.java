package com.hotel.booking.notification;

import com.hotel.booking.model.entity.BookingConfirmation;
import io.vertx.core.Future;

import java.math.BigDecimal;

/**
 * Guest notifications. Delivery may fail; booking flows log the failure and
 * carry on.
 */
public interface NotificationService {

    Future<Void> sendBookingConfirmation(BookingConfirmation booking, String email);

    Future<Void> sendModificationConfirmation(BookingConfirmation booking, String email);

    Future<Void> sendCancellationConfirmation(BookingConfirmation booking, BigDecimal refundAmount, String email);
}
