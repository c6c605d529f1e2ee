package com.hotel.booking.provider;

import com.hotel.booking.exception.ProviderException;
import com.hotel.booking.exception.ValidationException;
import com.hotel.booking.model.dto.BookingChanges;
import com.hotel.booking.model.dto.BookingRequest;
import com.hotel.booking.model.entity.AvailabilityResponse;
import com.hotel.booking.model.entity.BookingConfirmation;
import com.hotel.booking.model.entity.BookingStatus;
import com.hotel.booking.model.entity.CancellationConfirmation;
import com.hotel.booking.model.entity.CancellationPolicy;
import com.hotel.booking.model.entity.Hotel;
import com.hotel.booking.model.entity.RefundStatus;
import com.hotel.booking.model.entity.RoomOption;
import com.hotel.booking.service.CancellationRefundCalculator;
import com.hotel.booking.service.PricingCalculator;
import com.hotel.booking.service.RefundQuote;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Simulated inventory used as the fallback provider.
 *
 * -@Component: Always registered in the ProviderRegistry under "in-memory".
 * =========
 * INVENTORY:
 * - Every hotel offers three room types (room-{hotelId}-1/2/3) at 120, 180
 * and 280 per night
 * - Rooms held by confirmed bookings with overlapping stays are subtracted
 * from the available count
 * - Booking ids are BK1000, BK1001, ...; references REF-{millis}-{random}
 */
@Component
@Slf4j
public class InMemoryProviderAdapter implements BookingProviderAdapter {

    public static final String PROVIDER_ID = "in-memory";

    private static final List<RoomOption> ROOM_TYPES = List.of(
            room("1", "Standard Room", "Comfortable room with essential amenities", 2, "Queen", 25,
                    List.of("WiFi", "TV", "Air Conditioning"), "120", 5),
            room("2", "Deluxe Room", "Spacious room with premium amenities", 2, "King", 35,
                    List.of("WiFi", "TV", "Air Conditioning", "Mini Bar", "Balcony"), "180", 3),
            room("3", "Suite", "Luxurious suite with separate living area", 4, "King + Sofa Bed", 55,
                    List.of("WiFi", "TV", "Air Conditioning", "Mini Bar", "Balcony", "Kitchen"), "280", 2));

    private final HotelCatalog catalog;
    private final PricingCalculator pricingCalculator;
    private final CancellationRefundCalculator refundCalculator;
    private final Clock clock;

    private final Map<String, BookingConfirmation> bookings = new ConcurrentHashMap<>();
    private final AtomicInteger bookingCounter = new AtomicInteger(1000);

    @Autowired
    public InMemoryProviderAdapter(HotelCatalog catalog, PricingCalculator pricingCalculator,
            CancellationRefundCalculator refundCalculator, Clock clock) {
        this.catalog = catalog;
        this.pricingCalculator = pricingCalculator;
        this.refundCalculator = refundCalculator;
        this.clock = clock;
    }

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    public boolean supportsHotel(Hotel hotel) {
        return PROVIDER_ID.equals(hotel.getProviderId());
    }

    @Override
    public Future<AvailabilityResponse> checkAvailability(long hotelId, LocalDate checkInDate,
            LocalDate checkOutDate) {
        boolean instant = catalog.find(hotelId).map(Hotel::isInstantBooking).orElse(true);
        List<RoomOption> rooms = new ArrayList<>();
        for (RoomOption type : ROOM_TYPES) {
            String roomId = roomId(hotelId, type.getId());
            int held = heldRooms(hotelId, roomId, checkInDate, checkOutDate, null);
            rooms.add(type.toBuilder()
                    .id(roomId)
                    .available(Math.max(0, type.getAvailable() - held))
                    .instantBooking(instant)
                    .build());
        }
        log.debug("In-memory availability for hotel {} {} -> {}: {} room types",
                hotelId, checkInDate, checkOutDate, rooms.size());
        return Future.succeededFuture(AvailabilityResponse.builder()
                .hotelId(hotelId)
                .checkInDate(checkInDate)
                .checkOutDate(checkOutDate)
                .available(rooms.stream().anyMatch(r -> r.getAvailable() > 0))
                .rooms(rooms)
                .build());
    }

    @Override
    public Future<Hotel> getHotelDetails(long hotelId) {
        Hotel hotel = catalog.find(hotelId).orElseGet(() -> Hotel.builder()
                .id(hotelId)
                .title("Hotel " + hotelId)
                .providerId(PROVIDER_ID)
                .providerHotelId(String.valueOf(hotelId))
                .instantBooking(true)
                .checkInTime("15:00")
                .checkOutTime("11:00")
                .cancellationPolicy(CancellationPolicy.flexible())
                .build());
        return Future.succeededFuture(hotel);
    }

    @Override
    public Future<BookingConfirmation> createReservation(BookingRequest request) {
        return getHotelDetails(request.getHotelId()).compose(hotel -> {
            RoomOption room = bookableRoom(hotel.getId(), request.getRoomId(), request.getCheckInDate(),
                    request.getCheckOutDate(), null);
            Instant now = clock.instant();
            BookingConfirmation booking = BookingConfirmation.builder()
                    .bookingId("BK" + bookingCounter.getAndIncrement())
                    .referenceNumber(referenceNumber(now))
                    .hotel(hotel)
                    .checkInDate(request.getCheckInDate())
                    .checkOutDate(request.getCheckOutDate())
                    .guestInfo(request.getGuestInfo())
                    .roomDetails(room)
                    .pricing(pricingCalculator.calculate(room.getBasePrice(), request.getCheckInDate(),
                            request.getCheckOutDate()))
                    .status(BookingStatus.CONFIRMED)
                    .ownerId(request.getUserId())
                    .confirmationSentAt(now)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            bookings.put(booking.getBookingId(), booking);
            log.info("In-memory reservation {} created for hotel {} room {}",
                    booking.getBookingId(), hotel.getId(), room.getId());
            return Future.succeededFuture(booking);
        });
    }

    @Override
    public Future<BookingConfirmation> modifyReservation(String bookingId, BookingChanges changes) {
        BookingConfirmation existing = bookings.get(bookingId);
        if (existing == null) {
            return Future.failedFuture(new ProviderException(PROVIDER_ID, "Booking " + bookingId + " not found"));
        }
        if (existing.isCancelled()) {
            return Future.failedFuture(new ValidationException("Booking " + bookingId + " is cancelled"));
        }
        LocalDate checkIn = changes.getCheckInDate() != null ? changes.getCheckInDate() : existing.getCheckInDate();
        LocalDate checkOut = changes.getCheckOutDate() != null ? changes.getCheckOutDate()
                : existing.getCheckOutDate();
        String roomId = changes.getRoomId() != null ? changes.getRoomId() : existing.getRoomDetails().getId();

        RoomOption room;
        try {
            room = bookableRoom(existing.getHotel().getId(), roomId, checkIn, checkOut, bookingId);
        } catch (ValidationException e) {
            return Future.failedFuture(e);
        }

        BookingConfirmation updated = existing.toBuilder()
                .checkInDate(checkIn)
                .checkOutDate(checkOut)
                .roomDetails(room)
                .guestInfo(changes.getGuestInfo() != null ? changes.getGuestInfo() : existing.getGuestInfo())
                .pricing(pricingCalculator.calculate(room.getBasePrice(), checkIn, checkOut))
                .updatedAt(clock.instant())
                .build();
        bookings.put(bookingId, updated);
        log.info("In-memory reservation {} modified: {} -> {} room {}", bookingId, checkIn, checkOut, roomId);
        return Future.succeededFuture(updated);
    }

    @Override
    public Future<CancellationConfirmation> cancelReservation(String bookingId) {
        BookingConfirmation existing = bookings.get(bookingId);
        if (existing == null) {
            return Future.failedFuture(new ProviderException(PROVIDER_ID, "Booking " + bookingId + " not found"));
        }
        Instant now = clock.instant();
        RefundQuote quote = refundCalculator.calculate(existing);
        bookings.put(bookingId, existing.toBuilder().status(BookingStatus.CANCELLED).updatedAt(now).build());
        log.info("In-memory reservation {} cancelled, refund {}%", bookingId, quote.getRefundPercentage());
        return Future.succeededFuture(CancellationConfirmation.builder()
                .bookingId(bookingId)
                .referenceNumber(existing.getReferenceNumber())
                .cancelledAt(now)
                .refundPercentage(quote.getRefundPercentage())
                .refundAmount(quote.getAmount())
                .refundCurrency(existing.getPricing().getCurrency())
                .refundStatus(RefundStatus.PENDING)
                .build());
    }

    public List<BookingConfirmation> getAllBookings() {
        return new ArrayList<>(bookings.values());
    }

    public void clearBookings() {
        bookings.clear();
        bookingCounter.set(1000);
    }

    private RoomOption bookableRoom(long hotelId, String roomId, LocalDate checkIn, LocalDate checkOut,
            String ignoreBookingId) {
        RoomOption type = ROOM_TYPES.stream()
                .filter(t -> roomId(hotelId, t.getId()).equals(roomId))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Room not found: " + roomId));
        if (heldRooms(hotelId, roomId, checkIn, checkOut, ignoreBookingId) >= type.getAvailable()) {
            throw new ValidationException("Room not available: " + roomId);
        }
        boolean instant = catalog.find(hotelId).map(Hotel::isInstantBooking).orElse(true);
        return type.toBuilder().id(roomId).instantBooking(instant).build();
    }

    private int heldRooms(long hotelId, String roomId, LocalDate checkIn, LocalDate checkOut,
            String ignoreBookingId) {
        return (int) bookings.values().stream()
                .filter(b -> !b.isCancelled())
                .filter(b -> !b.getBookingId().equals(ignoreBookingId))
                .filter(b -> b.getHotel().getId() == hotelId && roomId.equals(b.getRoomDetails().getId()))
                .filter(b -> b.getCheckInDate().isBefore(checkOut) && checkIn.isBefore(b.getCheckOutDate()))
                .count();
    }

    private static String roomId(long hotelId, String suffix) {
        return "room-" + hotelId + "-" + suffix;
    }

    private static String referenceNumber(Instant now) {
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 9).toUpperCase(Locale.ROOT);
        return "REF-" + now.toEpochMilli() + "-" + random;
    }

    private static RoomOption room(String suffix, String name, String description, int capacity, String bedType,
            int size, List<String> amenities, String basePrice, int available) {
        return RoomOption.builder()
                .id(suffix)
                .name(name)
                .description(description)
                .capacity(capacity)
                .bedType(bedType)
                .size(size)
                .amenities(amenities)
                .basePrice(new BigDecimal(basePrice))
                .available(available)
                .build();
    }
}
