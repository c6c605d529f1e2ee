package com.hotel.booking.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RoomOption {
    private String id;
    private String name;
    private String description;
    private int capacity;
    private String bedType;

    // square meters
    private int size;
    private List<String> amenities;
    private BigDecimal basePrice;

    // number of rooms left for the requested stay
    private int available;
    private boolean instantBooking;
}
