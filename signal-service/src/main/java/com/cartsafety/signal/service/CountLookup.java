package com.cartsafety.signal.service;

import com.cartsafety.signal.client.ReportQuery;

import java.time.Instant;

/**
 * A report count with its provenance: when the source produced it and whether it came
 * out of the cache.
 */
public record CountLookup(ReportQuery query, long count, Instant fetchedAt, boolean cacheHit) {}
