package com.stkbarbershop.bookingservice.services.ratelimit;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class RateLimitDecision {

    private static final RateLimitDecision ADMITTED = new RateLimitDecision(true, Duration.ZERO);

    private final boolean admitted;

    /**
     * Time until the blocking window(s) would admit the client again; zero when admitted.
     */
    private final Duration retryAfter;

    public static RateLimitDecision admit() {
        return ADMITTED;
    }

    public static RateLimitDecision reject(Duration retryAfter) {
        return new RateLimitDecision(false, retryAfter.isNegative() ? Duration.ZERO : retryAfter);
    }

    /**
     * Whole seconds a client should wait, rounded up.
     */
    public long getRetryAfterSeconds() {
        long seconds = retryAfter.getSeconds();
        return retryAfter.getNano() > 0 ? seconds + 1 : seconds;
    }
}
