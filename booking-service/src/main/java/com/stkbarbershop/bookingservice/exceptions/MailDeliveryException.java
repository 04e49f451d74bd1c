package com.stkbarbershop.bookingservice.exceptions;

/**
 * The outbound mail relay could not deliver a notification, or is not configured.
 * The message is for operators; clients only see a generic delivery failure.
 */
public class MailDeliveryException extends RuntimeException {

    public MailDeliveryException(String message) {
        super(message);
    }

    public MailDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
