package com.stkbarbershop.bookingservice.exceptions;

import lombok.Getter;

/**
 * A booking payload failed validation. Client-caused; mapped to 400.
 */
@Getter
public class BookingValidationException extends RuntimeException {

    private final String field;
    private final ValidationReason reason;

    public BookingValidationException(String field, ValidationReason reason) {
        this(field, reason, reason.getDefaultMessage());
    }

    public BookingValidationException(String field, ValidationReason reason, String message) {
        super(message);
        this.field = field;
        this.reason = reason;
    }
}
