package com.cartsafety.signal.client;

import reactor.core.publisher.Mono;

/**
 * Counts spontaneous reports matching a {@link ReportQuery}.
 *
 * <p>Implementations signal {@link RateLimitedException} when the source refuses the
 * request for quota reasons and {@link ReportSourceException} for any other failure.
 * "No matching reports" is a count of zero, never an error.
 */
public interface ReportCountSource {

    Mono<Long> count(ReportQuery query);
}
