package com.hotel.booking.exception;

/**
 * Custom exception for unknown booking ids
 *
 * WHEN THROWN:
 * - getBooking / modifyBooking / cancelBooking with an id this process never
 * recorded
 * - Indicates a valid request for non-existent data (HTTP 404)
 *
 * USAGE:
 * throw new BookingNotFoundException("BK1001");
 */
public class BookingNotFoundException extends BookingException {

    private final String bookingId;

    public BookingNotFoundException(String bookingId) {
        super(ErrorType.NOT_FOUND, "Booking not found: " + bookingId, false);
        this.bookingId = bookingId;
    }

    public String getBookingId() {
        return bookingId;
    }
}
