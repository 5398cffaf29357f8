package com.cartsafety.signal.ratelimit;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Request budget for the external reporting database: at most {@code requests} calls per
 * {@code window}.
 *
 * <p>Backed by a Bucket4j token bucket whose capacity equals the budget and which refills
 * greedily over the window. Consumption is atomic, so concurrent callers can never
 * overspend it. A spent budget is reported to the caller instead of waiting.
 */
public class RequestBudget {

    private static final Logger log = LoggerFactory.getLogger(RequestBudget.class);

    private final Bucket bucket;
    private final long requests;
    private final Duration window;

    public RequestBudget(long requests, Duration window) {
        if (requests < 1) {
            throw new IllegalArgumentException("request budget must allow at least one request, got " + requests);
        }
        this.requests = requests;
        this.window = window;
        this.bucket = Bucket.builder()
            .addLimit(Bandwidth.builder()
                .capacity(requests)
                .refillGreedy(requests, window)
                .build())
            .build();
    }

    /** Takes one request from the budget; {@code false} if none is left. */
    public boolean tryAcquire(String key) {
        if (bucket.tryConsume(1)) {
            return true;
        }
        log.warn("RATE_LIMITED key={} budget={} windowSeconds={}", key, requests, window.toSeconds());
        return false;
    }

    public long available() {
        return bucket.getAvailableTokens();
    }
}
