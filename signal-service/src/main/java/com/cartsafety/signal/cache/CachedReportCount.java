package com.cartsafety.signal.cache;

import java.time.Instant;

/** One cached report count with the moment it was fetched from the source. */
public record CachedReportCount(long count, Instant fetchedAt) {}
