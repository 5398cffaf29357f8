package com.cartsafety.signal.config;

import com.cartsafety.signal.model.RecentApprovalPolicy;

import java.time.Duration;

/**
 * Service-level defaults applied when a request leaves them out.
 *
 * @param queryTimeout          deadline for one drug-event query
 * @param recentApprovalMonths  products approved within this many months of {@code asOf}
 *                              are subject to {@code recentApprovalPolicy}
 * @param sourceName            reported in diagnostics as the data source
 */
public record SignalDefaults(
    Duration queryTimeout,
    RecentApprovalPolicy recentApprovalPolicy,
    int recentApprovalMonths,
    String sourceName
) {}
