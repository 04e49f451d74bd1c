package com.stkbarbershop.bookingservice.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks an endpoint as subject to the per-client sliding-window rate limiter.
 * Window sizes and thresholds come from {@code booking.rate-limit.*}.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RateLimited {

    /**
     * Custom key suffix, for endpoints that should not share a client's history
     */
    String key() default "";

    /**
     * Error message to return when rate limit is exceeded
     */
    String message() default "Prea multe cereri. Încearcă din nou mai târziu.";
}
