package com.cartsafety.signal.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory cache of report counts, keyed by {@code ReportQuery.cacheKey()}.
 *
 * <p>Entries expire a fixed TTL after they were fetched. When the cache is full, expired
 * entries are dropped first and then the oldest entry is evicted.
 *
 * <p>Lookups are lock-free. Writes are serialised so that the size check, eviction and
 * insert happen as one step and the cache never holds more than {@code maxEntries}.
 */
public class ReportCountCache {

    private static final Logger log = LoggerFactory.getLogger(ReportCountCache.class);

    private final ConcurrentHashMap<String, CachedReportCount> store = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;

    public ReportCountCache(Duration ttl, int maxEntries, Clock clock) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("cache TTL must be positive, got " + ttl);
        }
        if (maxEntries < 1) {
            throw new IllegalArgumentException("cache needs room for at least one entry, got " + maxEntries);
        }
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    /**
     * Returns the entry for {@code key}, or {@code null} if absent or expired. An expired
     * entry is evicted on the way out.
     */
    public CachedReportCount get(String key) {
        CachedReportCount entry = store.get(key);
        if (entry == null) {
            return null;
        }
        if (isExpired(entry)) {
            store.remove(key, entry);
            return null;
        }
        return entry;
    }

    public synchronized CachedReportCount put(String key, long count) {
        CachedReportCount entry = new CachedReportCount(count, clock.instant());
        if (!store.containsKey(key) && store.size() >= maxEntries) {
            evict();
        }
        store.put(key, entry);
        log.info("CACHE_REFRESH key={} count={} ttlSeconds={}", key, count, ttl.toSeconds());
        return entry;
    }

    public boolean isExpired(CachedReportCount entry) {
        return clock.instant().isAfter(entry.fetchedAt().plus(ttl));
    }

    public int size() {
        return store.size();
    }

    private void evict() {
        store.entrySet().removeIf(e -> isExpired(e.getValue()));
        if (store.size() < maxEntries) {
            return;
        }
        store.entrySet().stream()
            .min(Comparator.comparing((Map.Entry<String, CachedReportCount> e) -> e.getValue().fetchedAt()))
            .ifPresent(oldest -> {
                store.remove(oldest.getKey(), oldest.getValue());
                log.info("CACHE_EVICT key={} fetchedAt={}", oldest.getKey(), oldest.getValue().fetchedAt());
            });
    }
}
