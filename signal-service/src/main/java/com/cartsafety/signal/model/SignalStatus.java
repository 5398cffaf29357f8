package com.cartsafety.signal.model;

/**
 * Outcome of one drug-event query. Only {@link #OK} carries metrics and a tier.
 */
public enum SignalStatus {
    /** Counts were obtained and scored. */
    OK,
    /** The source answered, but the drug or the event has no reports, so the ratios are undefined. */
    INSUFFICIENT_DATA,
    /** The source could not be queried; see {@link UnavailableReason}. Not a negative result. */
    UNAVAILABLE
}
