package com.stkbarbershop.bookingservice.dto.appointment;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Booking form submission as received on the wire. Nothing here is trusted;
 * see {@code AppointmentValidator}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AppointmentRequest {

    @JsonProperty("full_name")
    private String fullName;

    private String phone;

    private String email;

    private String service;

    // YYYY-MM-DD
    private String date;

    // HH:MM
    private String time;

    private String message;

    @JsonProperty("captcha_a")
    private Integer captchaA;

    @JsonProperty("captcha_b")
    private Integer captchaB;

    @JsonProperty("captcha_result")
    private Integer captchaResult;
}
