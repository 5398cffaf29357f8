package com.cartsafety.signal.model;

/**
 * Treatment of signals for products approved within the recent-approval window, where
 * stimulated reporting inflates disproportionality.
 */
public enum RecentApprovalPolicy {
    /** Keep the tier and attach a warning. */
    ANNOTATE,
    /** Report the tier as NONE and keep the computed one in {@code suppressedTier}. */
    SUPPRESS
}
