package com.stkbarbershop.bookingservice.exceptions;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Why a booking payload was rejected. Messages are client-facing.
 */
@Getter
@RequiredArgsConstructor
public enum ValidationReason {
    MISSING_FIELD("Câmp obligatoriu lipsă"),
    MALFORMED_FIELD("Valoare invalidă"),
    INVALID_NAME("Numele trebuie să conțină cel puțin 2 caractere"),
    INVALID_PHONE("Număr de telefon invalid"),
    INVALID_EMAIL("Adresă de email invalidă"),
    INVALID_SERVICE("Serviciu invalid"),
    INVALID_DATE("Format dată invalid (YYYY-MM-DD)"),
    INVALID_TIME("Format oră invalid (HH:MM)"),
    PAST_DATE_TIME("Data și ora nu pot fi în trecut"),
    CAPTCHA_FAILED("Captcha invalid");

    private final String defaultMessage;
}
