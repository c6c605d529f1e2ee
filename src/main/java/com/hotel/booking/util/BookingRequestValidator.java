package com.hotel.booking.util;

import com.hotel.booking.config.BookingProperties;
import com.hotel.booking.exception.ValidationException;
import com.hotel.booking.model.dto.BookingRequest;
import com.hotel.booking.model.entity.GuestInfo;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks on booking input. All violations are collected and
 * raised together as one ValidationException.
 */
@Component
public class BookingRequestValidator {

    private final Clock clock;
    private final ZoneId zone;

    @Autowired
    public BookingRequestValidator(Clock clock, BookingProperties properties) {
        this.clock = clock;
        this.zone = ZoneId.of(properties.getZone());
    }

    public void validate(BookingRequest request) {
        List<String> errors = new ArrayList<>();

        if (request.getHotelId() == null || request.getHotelId() <= 0) {
            errors.add("Hotel ID is required");
        }
        if (isBlank(request.getRoomId())) {
            errors.add("Room ID is required");
        }
        if (request.getCheckInDate() == null) {
            errors.add("Check-in date is required");
        }
        if (request.getCheckOutDate() == null) {
            errors.add("Check-out date is required");
        }
        errors.addAll(stayViolations(request.getCheckInDate(), request.getCheckOutDate()));

        GuestInfo guest = request.getGuestInfo() == null ? new GuestInfo() : request.getGuestInfo();
        if (isBlank(guest.getFirstName())) {
            errors.add("Guest first name is required");
        }
        if (isBlank(guest.getLastName())) {
            errors.add("Guest last name is required");
        }
        if (isBlank(guest.getEmail())) {
            errors.add("Guest email is required");
        }
        if (isBlank(guest.getPhone())) {
            errors.add("Guest phone is required");
        }
        if (isBlank(request.getPaymentMethodId())) {
            errors.add("Payment method is required");
        }

        if (!errors.isEmpty()) {
            throw ValidationException.of(errors);
        }
    }

    /**
     * Check-in not in the past and check-out after check-in, for a new or
     * modified stay.
     */
    public void validateStay(LocalDate checkIn, LocalDate checkOut) {
        List<String> errors = stayViolations(checkIn, checkOut);
        if (!errors.isEmpty()) {
            throw ValidationException.of(errors);
        }
    }

    /**
     * Only the ordering rule; availability and pricing lookups may ask about
     * past dates.
     */
    public void validateDateOrder(LocalDate checkIn, LocalDate checkOut) {
        if (checkIn == null || checkOut == null) {
            throw new ValidationException("Check-in and check-out dates are required");
        }
        if (!checkOut.isAfter(checkIn)) {
            throw new ValidationException("Check-out date must be after check-in date");
        }
    }

    private List<String> stayViolations(LocalDate checkIn, LocalDate checkOut) {
        List<String> errors = new ArrayList<>();
        if (checkIn != null && checkIn.isBefore(LocalDate.now(clock.withZone(zone)))) {
            errors.add("Check-in date cannot be in the past");
        }
        if (checkIn != null && checkOut != null && !checkOut.isAfter(checkIn)) {
            errors.add("Check-out date must be after check-in date");
        }
        return errors;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
