package com.stkbarbershop.bookingservice.services;

import com.stkbarbershop.bookingservice.dto.appointment.AppointmentRequest;
import com.stkbarbershop.bookingservice.dto.appointment.AppointmentResponse;
import com.stkbarbershop.bookingservice.models.ValidatedAppointment;
import com.stkbarbershop.bookingservice.services.appointment.AppointmentValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class AppointmentBookingService {

    static final String SUCCESS_MESSAGE = "Programarea a fost trimisă cu succes.";

    private final AppointmentValidator appointmentValidator;
    private final BookingNotificationService notificationService;

    /**
     * Validate a booking and forward it to the shop by email.
     * Callers are expected to have applied the rate limit already.
     *
     * @param request The raw booking form submission.
     * @return A success response once the notification has been accepted by the relay.
     */
    public AppointmentResponse book(AppointmentRequest request) {
        ValidatedAppointment appointment = appointmentValidator.validate(request);

        notificationService.sendAppointmentNotification(appointment);

        log.info("Appointment booked: service={} at {} (phone {})",
                appointment.getService(), appointment.getDateTime(), maskPhoneNumber(appointment.getPhone()));

        return AppointmentResponse.builder()
                .success(true)
                .message(SUCCESS_MESSAGE)
                .build();
    }

    private String maskPhoneNumber(String phone) {
        if (phone == null || phone.length() < 4) {
            return "****";
        }
        return "****" + phone.substring(phone.length() - 4);
    }
}
