package com.stkbarbershop.bookingservice.configurations;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;

@ConfigurationProperties(prefix = "booking")
@Validated
@Getter
@Setter
public class BookingProperties {

    /**
     * Zone in which submitted appointment dates and times are interpreted.
     */
    @NotNull
    private ZoneId timeZone = ZoneId.of("Europe/Bucharest");

    @Valid
    @NotNull
    private RateLimit rateLimit = new RateLimit();

    @Valid
    @NotNull
    private Mail mail = new Mail();

    @Getter
    @Setter
    public static class RateLimit {

        @NotNull
        private Duration shortWindow = Duration.ofSeconds(15);

        @Positive
        private int shortMaxRequests = 1;

        @NotNull
        private Duration longWindow = Duration.ofMinutes(5);

        @Positive
        private int longMaxRequests = 5;

        // Upper bound on distinct client ids held in memory
        @Positive
        private long maxTrackedClients = 50_000;

        // Only enable behind a reverse proxy that overwrites these headers
        private boolean trustForwardedHeaders = false;
    }

    @Getter
    @Setter
    public static class Mail {

        private String from;

        @Email
        private String to = "stkbarbershop@gmail.com";

        private String senderName = "Stk Barbershop";
    }
}
