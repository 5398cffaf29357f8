package com.cartsafety.signal.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ReportCountCacheTest {

    /** Clock the test moves by hand. */
    private static final class ManualClock extends Clock {
        private Instant now = Instant.parse("2026-10-19T08:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    @Test
    @DisplayName("entry served until its TTL passes, then evicted as a miss")
    void ttl() {
        ManualClock clock = new ManualClock();
        ReportCountCache cache = new ReportCountCache(Duration.ofHours(24), 10, clock);
        cache.put("KYMRIAH|*|latest", 1000);

        clock.advance(Duration.ofHours(23));
        assertEquals(1000, cache.get("KYMRIAH|*|latest").count());

        clock.advance(Duration.ofHours(2));
        assertNull(cache.get("KYMRIAH|*|latest"));
        assertEquals(0, cache.size());
    }

    @Test
    @DisplayName("full cache → oldest entry evicted")
    void evictsOldest() {
        ManualClock clock = new ManualClock();
        ReportCountCache cache = new ReportCountCache(Duration.ofHours(24), 2, clock);
        cache.put("a", 1);
        clock.advance(Duration.ofMinutes(1));
        cache.put("b", 2);
        clock.advance(Duration.ofMinutes(1));
        cache.put("c", 3);

        assertEquals(2, cache.size());
        assertNull(cache.get("a"));
        assertNotNull(cache.get("b"));
        assertNotNull(cache.get("c"));
    }

    @Test
    @DisplayName("refreshing an existing key never evicts another")
    void refresh() {
        ManualClock clock = new ManualClock();
        ReportCountCache cache = new ReportCountCache(Duration.ofHours(24), 2, clock);
        cache.put("a", 1);
        cache.put("b", 2);
        cache.put("a", 5);

        assertEquals(5, cache.get("a").count());
        assertNotNull(cache.get("b"));
    }

    @Test
    @DisplayName("concurrent misses on distinct keys never push the cache past its bound")
    void concurrentMissesStayBounded() throws Exception {
        ReportCountCache cache = new ReportCountCache(Duration.ofHours(24), 50, Clock.systemUTC());
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> writes = new ArrayList<>();
            for (int i = 0; i < 500; i++) {
                String key = "DRUG" + i + "|*|latest";
                long count = i;
                writes.add(pool.submit(() -> {
                    cache.put(key, count);
                    assertTrue(cache.size() <= 50);
                }));
            }
            for (Future<?> write : writes) {
                write.get(5, TimeUnit.SECONDS);
            }
            assertEquals(50, cache.size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("non-positive TTL rejected")
    void invalidTtl() {
        assertThrows(IllegalArgumentException.class,
            () -> new ReportCountCache(Duration.ZERO, 10, Clock.systemUTC()));
    }
}
