package com.stkbarbershop.bookingservice.services.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.stkbarbershop.bookingservice.configurations.BookingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-client rate limiter with two overlapping sliding windows: a short one that
 * stops immediate hammering and a long one that stops sustained abuse.
 * <p>
 * Only admitted requests are recorded. Stale timestamps are pruned on every
 * check, rejected ones included, so no background sweep is needed.
 * The whole read-prune-decide-append sequence for a client runs inside
 * {@code ConcurrentMap.compute}, which serializes concurrent requests from the
 * same client while different clients proceed in parallel.
 */
@Service
@Slf4j
public class SlidingWindowRateLimiter {

    private final Cache<String, ClientRequestHistory> histories;
    private final Duration shortWindow;
    private final int shortMaxRequests;
    private final Duration longWindow;
    private final int longMaxRequests;

    public SlidingWindowRateLimiter(Cache<String, ClientRequestHistory> rateLimitCache,
            BookingProperties properties) {
        BookingProperties.RateLimit settings = properties.getRateLimit();
        if (settings.getShortWindow().compareTo(settings.getLongWindow()) > 0) {
            throw new IllegalArgumentException("Short rate-limit window must not exceed the long window");
        }
        this.histories = rateLimitCache;
        this.shortWindow = settings.getShortWindow();
        this.shortMaxRequests = settings.getShortMaxRequests();
        this.longWindow = settings.getLongWindow();
        this.longMaxRequests = settings.getLongMaxRequests();
    }

    /**
     * Decides whether {@code clientId} may make a request at {@code now} and,
     * if so, records it.
     *
     * @param clientId the client identifier, typically its source address
     * @param now      the instant of the request
     * @return the decision; never throws for a rejected client
     */
    public RateLimitDecision checkAndRecord(String clientId, Instant now) {
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(now, "now");

        AtomicReference<RateLimitDecision> decision = new AtomicReference<>();

        histories.asMap().compute(clientId, (key, existing) -> {
            ClientRequestHistory history = existing != null ? existing : new ClientRequestHistory();
            history.pruneBefore(now.minus(longWindow));

            List<Instant> shortWindowRequests = history.since(now.minus(shortWindow));
            List<Instant> longWindowRequests = history.since(now.minus(longWindow));

            if (shortWindowRequests.size() >= shortMaxRequests || longWindowRequests.size() >= longMaxRequests) {
                Duration retryAfter = Duration.ZERO;
                if (shortWindowRequests.size() >= shortMaxRequests) {
                    retryAfter = max(retryAfter,
                            waitUntilBelowLimit(shortWindowRequests, shortMaxRequests, shortWindow, now));
                }
                if (longWindowRequests.size() >= longMaxRequests) {
                    retryAfter = max(retryAfter,
                            waitUntilBelowLimit(longWindowRequests, longMaxRequests, longWindow, now));
                }
                decision.set(RateLimitDecision.reject(retryAfter));
            } else {
                history.record(now);
                decision.set(RateLimitDecision.admit());
            }
            return history;
        });

        RateLimitDecision result = decision.get();
        if (!result.isAdmitted()) {
            log.debug("Rate limit exceeded for client: {} (retry after {}s)", clientId, result.getRetryAfterSeconds());
        }
        return result;
    }

    /**
     * Estimated number of clients whose history is currently held.
     */
    public long trackedClients() {
        return histories.estimatedSize();
    }

    /**
     * The window admits again once enough of its oldest entries have aged past
     * it. An entry exactly {@code window} old still counts, hence the extra nanosecond.
     */
    private Duration waitUntilBelowLimit(List<Instant> requestsInWindow, int maxRequests, Duration window,
            Instant now) {
        Instant blocking = requestsInWindow.get(requestsInWindow.size() - maxRequests);
        return Duration.between(now, blocking.plus(window)).plusNanos(1);
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
