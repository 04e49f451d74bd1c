package com.stkbarbershop.bookingservice.services.ratelimit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Timestamps of one client's admitted requests.
 * <p>
 * Not thread-safe: every access goes through the limiter's per-key
 * critical section.
 */
public class ClientRequestHistory {

    private final List<Instant> timestamps = new ArrayList<>();

    /**
     * Drops every timestamp strictly before {@code cutoff}.
     */
    public void pruneBefore(Instant cutoff) {
        timestamps.removeIf(timestamp -> timestamp.isBefore(cutoff));
    }

    /**
     * Returns the retained timestamps at or after {@code cutoff}, oldest first.
     */
    public List<Instant> since(Instant cutoff) {
        return timestamps.stream()
                .filter(timestamp -> !timestamp.isBefore(cutoff))
                .sorted()
                .toList();
    }

    public void record(Instant timestamp) {
        timestamps.add(timestamp);
    }
}
