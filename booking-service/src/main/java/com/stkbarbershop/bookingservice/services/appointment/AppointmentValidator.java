package com.stkbarbershop.bookingservice.services.appointment;

import com.stkbarbershop.bookingservice.configurations.BookingProperties;
import com.stkbarbershop.bookingservice.dto.appointment.AppointmentRequest;
import com.stkbarbershop.bookingservice.exceptions.BookingValidationException;
import com.stkbarbershop.bookingservice.exceptions.ValidationReason;
import com.stkbarbershop.bookingservice.models.ValidatedAppointment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns an untrusted {@link AppointmentRequest} into a {@link ValidatedAppointment}.
 * <p>
 * Checks run in a fixed order and the first failure is thrown, so the reported
 * error for a given payload is always the same: required fields present, then
 * name, phone, email, service, date, time, then the appointment being in the
 * future, then the arithmetic captcha.
 * <p>
 * The captcha is computed by the client and only keeps naive scripted
 * submissions out. It is not a security control.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AppointmentValidator {

    public static final Set<String> ALLOWED_SERVICES = Set.of("tuns", "aranjat barba", "pachet complet");

    private static final int MIN_NAME_LENGTH = 2;

    private static final Pattern PHONE_PATTERN = Pattern.compile("^\\+?[0-9]{8,15}$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern EMAIL_PATTERN = Pattern.compile(
            "^[A-Za-z0-9+_.-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$");

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm")
            .withResolverStyle(ResolverStyle.STRICT);

    private final Clock clock;
    private final BookingProperties properties;

    public ValidatedAppointment validate(AppointmentRequest request) {
        if (request == null) {
            throw new BookingValidationException("body", ValidationReason.MISSING_FIELD);
        }

        requirePresent("full_name", request.getFullName());
        requirePresent("phone", request.getPhone());
        requirePresent("service", request.getService());
        requirePresent("date", request.getDate());
        requirePresent("time", request.getTime());
        requirePresent("captcha_a", request.getCaptchaA());
        requirePresent("captcha_b", request.getCaptchaB());
        requirePresent("captcha_result", request.getCaptchaResult());

        String fullName = validateName(request.getFullName());
        String phone = validatePhone(request.getPhone());
        String email = validateEmail(request.getEmail());
        String service = validateService(request.getService());
        LocalDate date = validateDate(request.getDate());
        LocalTime time = validateTime(request.getTime());

        ValidatedAppointment appointment = ValidatedAppointment.builder()
                .fullName(fullName)
                .phone(phone)
                .email(email)
                .service(service)
                .date(date)
                .time(time)
                .message(normalizeMessage(request.getMessage()))
                .build();

        validateInFuture(appointment);
        validateCaptcha(request.getCaptchaA(), request.getCaptchaB(), request.getCaptchaResult());

        return appointment;
    }

    private void requirePresent(String field, Object value) {
        if (value == null) {
            throw new BookingValidationException(field, ValidationReason.MISSING_FIELD,
                    ValidationReason.MISSING_FIELD.getDefaultMessage() + ": " + field);
        }
    }

    private String validateName(String fullName) {
        String trimmed = fullName.strip();
        // Count code points so a single emoji (a surrogate pair) is still one character
        if (trimmed.codePointCount(0, trimmed.length()) < MIN_NAME_LENGTH) {
            throw new BookingValidationException("full_name", ValidationReason.INVALID_NAME);
        }
        return trimmed;
    }

    private String validatePhone(String phone) {
        String normalized = WHITESPACE.matcher(phone).replaceAll("");
        if (!PHONE_PATTERN.matcher(normalized).matches()) {
            throw new BookingValidationException("phone", ValidationReason.INVALID_PHONE);
        }
        return normalized;
    }

    /**
     * A blank email is treated the same as an absent one.
     */
    private String validateEmail(String email) {
        if (email == null || email.isBlank()) {
            return null;
        }
        String trimmed = email.trim();
        if (!EMAIL_PATTERN.matcher(trimmed).matches()) {
            throw new BookingValidationException("email", ValidationReason.INVALID_EMAIL);
        }
        return trimmed;
    }

    private String validateService(String service) {
        String normalized = service.strip().toLowerCase(Locale.ROOT);
        if (!ALLOWED_SERVICES.contains(normalized)) {
            throw new BookingValidationException("service", ValidationReason.INVALID_SERVICE);
        }
        return normalized;
    }

    private LocalDate validateDate(String date) {
        try {
            return LocalDate.parse(date, DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw new BookingValidationException("date", ValidationReason.INVALID_DATE);
        }
    }

    private LocalTime validateTime(String time) {
        try {
            return LocalTime.parse(time, TIME_FORMAT);
        } catch (DateTimeParseException e) {
            throw new BookingValidationException("time", ValidationReason.INVALID_TIME);
        }
    }

    /**
     * Strictly after now: an appointment at exactly the current instant is rejected.
     */
    private void validateInFuture(ValidatedAppointment appointment) {
        ZonedDateTime appointmentAt = appointment.getDateTime().atZone(properties.getTimeZone());
        if (!appointmentAt.toInstant().isAfter(clock.instant())) {
            throw new BookingValidationException("date", ValidationReason.PAST_DATE_TIME);
        }
    }

    private void validateCaptcha(int a, int b, int result) {
        if ((long) a + b != result) {
            log.debug("Captcha mismatch: {} + {} != {}", a, b, result);
            throw new BookingValidationException("captcha_result", ValidationReason.CAPTCHA_FAILED);
        }
    }

    private String normalizeMessage(String message) {
        if (message == null || message.isBlank()) {
            return null;
        }
        return message.trim();
    }
}
