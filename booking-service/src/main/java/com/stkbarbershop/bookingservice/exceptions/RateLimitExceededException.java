package com.stkbarbershop.bookingservice.exceptions;

import lombok.Getter;

@Getter
public class RateLimitExceededException extends RuntimeException {

    private final String clientId;
    private final long retryAfterSeconds;

    public RateLimitExceededException(String message, String clientId, long retryAfterSeconds) {
        super(message);
        this.clientId = clientId;
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
