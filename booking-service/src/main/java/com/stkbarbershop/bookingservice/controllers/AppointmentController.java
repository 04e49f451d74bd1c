package com.stkbarbershop.bookingservice.controllers;

import com.stkbarbershop.bookingservice.annotations.RateLimited;
import com.stkbarbershop.bookingservice.dto.appointment.AppointmentRequest;
import com.stkbarbershop.bookingservice.dto.appointment.AppointmentResponse;
import com.stkbarbershop.bookingservice.services.AppointmentBookingService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AppointmentController {

    private final AppointmentBookingService bookingService;

    /**
     * Submit a booking from the public form; the shop is notified by email.
     *
     * @param request The booking form fields.
     * @return A response entity with the booking status.
     */
    @PostMapping("/appointment")
    @RateLimited
    public ResponseEntity<AppointmentResponse> createAppointment(@RequestBody AppointmentRequest request) {
        return ResponseEntity.ok(bookingService.book(request));
    }
}
