package com.cartsafety.signal.client;

/**
 * The request budget is spent, locally or as reported by the source (HTTP 429).
 * Never retried.
 */
public class RateLimitedException extends ReportSourceException {

    public RateLimitedException(String message) {
        super(message);
    }
}
