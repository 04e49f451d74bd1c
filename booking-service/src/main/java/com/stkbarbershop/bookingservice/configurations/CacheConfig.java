package com.stkbarbershop.bookingservice.configurations;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.stkbarbershop.bookingservice.services.ratelimit.ClientRequestHistory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * In-memory store for the rate limiter's per-client request histories.
 * <p>
 * A history untouched for longer than the long window holds nothing that can
 * still reject a request, so idle entries expire after that long. The size cap
 * bounds memory when source addresses are spoofed.
 */
@Configuration
public class CacheConfig {

    @Bean
    public Cache<String, ClientRequestHistory> rateLimitCache(BookingProperties properties,
            ObjectProvider<Ticker> ticker) {
        return rateLimitCache(properties, ticker.getIfAvailable(Ticker::systemTicker));
    }

    /**
     * Builds the history cache against the given time source for expiry.
     */
    public Cache<String, ClientRequestHistory> rateLimitCache(BookingProperties properties, Ticker ticker) {
        BookingProperties.RateLimit rateLimit = properties.getRateLimit();
        return Caffeine.newBuilder()
                .ticker(ticker)
                .expireAfterAccess(rateLimit.getLongWindow())
                .maximumSize(rateLimit.getMaxTrackedClients())
                .recordStats()
                .build();
    }
}
