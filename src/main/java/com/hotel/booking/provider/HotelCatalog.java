package com.hotel.booking.provider;

import com.hotel.booking.model.entity.CancellationPolicy;
import com.hotel.booking.model.entity.Hotel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * -@Component: In-memory directory of known hotels.
 * --Supplies the provider binding and cancellation policy for a hotel id
 * --WithoutIT: every hotel would resolve to the fallback provider with no
 * cancellation policy, so cancellations would never refund.
 * =========
 * -@Slf4j: Logs catalog loading.
 */
@Component
@Slf4j
public class HotelCatalog {

    private final Map<Long, Hotel> hotels = new ConcurrentHashMap<>();

    /**
     * -@PostConstruct: Loads the demo hotels once the bean is created.
     */
    @PostConstruct
    public void loadDefaults() {
        register(hotel(1, "The Serene Lakehouse", "Lake Como, Italy", true, "15:00", CancellationPolicy.flexible()));
        register(hotel(2, "Urban Loft Downtown", "New York, USA", true, "15:00", CancellationPolicy.moderate()));
        register(hotel(3, "Mountain Retreat Lodge", "Aspen, Colorado", false, "16:00", CancellationPolicy.strict()));
        register(hotel(4, "Beach Paradise Resort", "Maldives", true, "14:00", CancellationPolicy.nonRefundable()));
        log.info("Hotel catalog loaded with {} hotels", hotels.size());
    }

    public void register(Hotel hotel) {
        hotels.put(hotel.getId(), hotel);
    }

    public Optional<Hotel> find(long hotelId) {
        return Optional.ofNullable(hotels.get(hotelId));
    }

    /**
     * Catalog entry, or a bare hotel with only its id when unknown; the bare hotel
     * has no provider binding.
     */
    public Hotel resolve(long hotelId) {
        return find(hotelId).orElseGet(() -> Hotel.builder().id(hotelId).build());
    }

    public List<Hotel> findAll() {
        return hotels.values().stream()
                .sorted(Comparator.comparingLong(Hotel::getId))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    public void clear() {
        hotels.clear();
    }

    private static Hotel hotel(long id, String title, String location, boolean instant, String checkInTime,
            CancellationPolicy policy) {
        return Hotel.builder()
                .id(id)
                .title(title)
                .location(location)
                .providerId(InMemoryProviderAdapter.PROVIDER_ID)
                .providerHotelId(String.valueOf(id))
                .instantBooking(instant)
                .checkInTime(checkInTime)
                .checkOutTime("11:00")
                .cancellationPolicy(policy)
                .build();
    }
}
