package com.hotel.booking.service;

import com.hotel.booking.model.entity.BookingConfirmation;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Bookings created through this process, keyed by booking id. Process-local;
 * a restart clears it.
 *
 * Entries are replaced whole, only after an operation fully succeeded.
 */
@Component
public class BookingLedger {

    private final Map<String, BookingConfirmation> bookings = new ConcurrentHashMap<>();

    public void save(BookingConfirmation booking) {
        bookings.put(booking.getBookingId(), booking);
    }

    public Optional<BookingConfirmation> find(String bookingId) {
        return bookingId == null ? Optional.empty() : Optional.ofNullable(bookings.get(bookingId));
    }

    // Newest first
    public List<BookingConfirmation> findByOwner(String ownerId) {
        return bookings.values().stream()
                .filter(b -> ownerId != null && ownerId.equals(b.getOwnerId()))
                .sorted(Comparator.comparing(BookingConfirmation::getCreatedAt,
                        Comparator.nullsFirst(Comparator.<Instant>naturalOrder())).reversed())
                .collect(Collectors.toList());
    }

    public int size() {
        return bookings.size();
    }

    public void clear() {
        bookings.clear();
    }
}
