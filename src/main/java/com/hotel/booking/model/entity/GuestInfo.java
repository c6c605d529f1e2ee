package com.hotel.booking.model.entity;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GuestInfo {
    private String firstName;
    private String lastName;
    private String email;
    private String phone;
    private String country;
    private String specialRequests;
    private String arrivalTime;
}
