package com.cartsafety.signal.service;

import com.cartsafety.signal.cache.CachedReportCount;
import com.cartsafety.signal.cache.ReportCountCache;
import com.cartsafety.signal.client.RateLimitedException;
import com.cartsafety.signal.client.ReportCountSource;
import com.cartsafety.signal.client.ReportQuery;
import com.cartsafety.signal.client.ReportSourceException;
import com.cartsafety.signal.ratelimit.RequestBudget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Single entry point to the reporting database.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Serve a valid cache entry without touching the source.</li>
 *   <li>On miss, take one request from the {@link RequestBudget}; a spent budget fails
 *       with {@link RateLimitedException}.</li>
 *   <li>Query the source. Source failures are retried with exponential backoff, each
 *       attempt paying from the same budget. Rate-limit refusals are not retried.</li>
 *   <li>Cache the count.</li>
 * </ol>
 */
public class ReportCountGateway {

    private static final Logger log = LoggerFactory.getLogger(ReportCountGateway.class);

    private final ReportCountSource source;
    private final ReportCountCache cache;
    private final RequestBudget budget;
    private final int maxRetries;
    private final Duration initialBackoff;

    public ReportCountGateway(ReportCountSource source, ReportCountCache cache, RequestBudget budget,
                              int maxRetries, Duration initialBackoff) {
        this.source = source;
        this.cache = cache;
        this.budget = budget;
        this.maxRetries = maxRetries;
        this.initialBackoff = initialBackoff;
    }

    public Mono<CountLookup> count(ReportQuery query) {
        String key = query.cacheKey();
        return Mono.defer(() -> {
            CachedReportCount cached = cache.get(key);
            if (cached != null) {
                log.info("CACHE_HIT key={} fetchedAt={}", key, cached.fetchedAt());
                return Mono.just(new CountLookup(query, cached.count(), cached.fetchedAt(), true));
            }

            log.info("CACHE_MISS key={}", key);
            return fetch(query)
                .map(count -> {
                    CachedReportCount entry = cache.put(key, count);
                    return new CountLookup(query, entry.count(), entry.fetchedAt(), false);
                });
        });
    }

    private Mono<Long> fetch(ReportQuery query) {
        String key = query.cacheKey();
        return Mono.defer(() -> {
                if (!budget.tryAcquire(key)) {
                    return Mono.error(new RateLimitedException("request budget exhausted before querying " + key));
                }
                return source.count(query);
            })
            .retryWhen(Retry.backoff(maxRetries, initialBackoff)
                .filter(e -> e instanceof ReportSourceException && !(e instanceof RateLimitedException))
                .doBeforeRetry(retry -> log.warn("SOURCE_RETRY key={} attempt={} reason={}",
                    key, retry.totalRetries() + 1, retry.failure().getMessage()))
                .onRetryExhaustedThrow((spec, retry) -> retry.failure()));
    }
}
