package com.stkbarbershop.bookingservice.models;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * A booking that passed every validation step, with normalized fields.
 * Its {@link #getDateTime()} was strictly in the future when it was built.
 * Never persisted.
 */
@Value
@Builder
public class ValidatedAppointment {

    String fullName;

    // Whitespace stripped
    String phone;

    // Null when not supplied
    String email;

    // Lower-case, one of the offered services
    String service;

    LocalDate date;

    LocalTime time;

    String message;

    public LocalDateTime getDateTime() {
        return LocalDateTime.of(date, time);
    }
}
