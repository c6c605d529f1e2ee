package com.hotel.booking.provider;

import com.hotel.booking.model.dto.BookingChanges;
import com.hotel.booking.model.dto.BookingRequest;
import com.hotel.booking.model.entity.AvailabilityResponse;
import com.hotel.booking.model.entity.BookingConfirmation;
import com.hotel.booking.model.entity.CancellationConfirmation;
import com.hotel.booking.model.entity.Hotel;
import io.vertx.core.Future;

import java.time.LocalDate;

/**
 * Integration contract for one external inventory/reservation system.
 *
 * Implementations are registered in the ProviderRegistry under their
 * providerId. Every call is asynchronous; a failed Future with a
 * ProviderException marks a transient failure the caller may retry.
 */
public interface BookingProviderAdapter {

    String providerId();

    /**
     * Capability check used when a hotel carries no explicit provider binding.
     */
    boolean supportsHotel(Hotel hotel);

    Future<AvailabilityResponse> checkAvailability(long hotelId, LocalDate checkInDate, LocalDate checkOutDate);

    Future<Hotel> getHotelDetails(long hotelId);

    Future<BookingConfirmation> createReservation(BookingRequest request);

    Future<BookingConfirmation> modifyReservation(String bookingId, BookingChanges changes);

    Future<CancellationConfirmation> cancelReservation(String bookingId);
}
